package io.b2mash.siteledger.purchase;

import io.b2mash.siteledger.exception.InputValidation;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.InvalidTransitionException;
import io.b2mash.siteledger.money.MonetaryCalculator;
import io.b2mash.siteledger.money.VatRates;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A purchase order against a project. {@code totalHt}, {@code vatAmount} and {@code totalTtc} are
 * recomputed whenever quantity, unit price or VAT rate change. When set by reconciliation, {@code
 * realAmountHt} replaces {@code totalHt} in every aggregation.
 */
@Entity
@Table(name = "purchase_orders")
public class PurchaseOrder {

  private static final String ENTITY = "PurchaseOrder";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "supplier_id")
  private UUID supplierId;

  @Column(name = "lot_id")
  private UUID lotId;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 20)
  private PurchaseType type;

  @Column(name = "label", nullable = false, length = 500)
  private String label;

  @Column(name = "quantity", nullable = false, precision = 12, scale = 3)
  private BigDecimal quantity;

  @Column(name = "unit", length = 20)
  private String unit;

  @Column(name = "unit_price_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal unitPriceHt;

  @Column(name = "vat_rate", nullable = false, precision = 5, scale = 2)
  private BigDecimal vatRate;

  @Column(name = "total_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal totalHt;

  @Column(name = "vat_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal vatAmount;

  @Column(name = "total_ttc", nullable = false, precision = 14, scale = 2)
  private BigDecimal totalTtc;

  @Column(name = "order_date")
  private LocalDate orderDate;

  @Column(name = "expected_delivery_date")
  private LocalDate expectedDeliveryDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private PurchaseOrderStatus status;

  @Column(name = "invoice_reference", length = 100)
  private String invoiceReference;

  @Column(name = "rejection_reason", columnDefinition = "TEXT")
  private String rejectionReason;

  @Column(name = "comment", columnDefinition = "TEXT")
  private String comment;

  @Column(name = "requested_by")
  private UUID requestedBy;

  @Column(name = "approved_by")
  private UUID approvedBy;

  @Column(name = "approved_at")
  private Instant approvedAt;

  @Column(name = "real_amount_ht", precision = 14, scale = 2)
  private BigDecimal realAmountHt;

  @Column(name = "real_invoice_date")
  private LocalDate realInvoiceDate;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "deleted_by")
  private UUID deletedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PurchaseOrder() {}

  public PurchaseOrder(
      UUID projectId,
      PurchaseType type,
      String label,
      BigDecimal quantity,
      BigDecimal unitPriceHt,
      BigDecimal vatRate,
      UUID requestedBy) {
    this.projectId = InputValidation.requirePresent("projectId", projectId);
    this.label = InputValidation.requireText("label", label);
    this.requestedBy = requestedBy;
    this.status = PurchaseOrderStatus.REQUESTED;
    applyPricing(InputValidation.requirePresent("type", type), quantity, unitPriceHt, vatRate);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  // --- Transitions ---

  public void approve(UUID approverId) {
    transitionTo(PurchaseOrderStatus.APPROVED);
    this.approvedBy = approverId;
    this.approvedAt = Instant.now();
  }

  public void reject(UUID approverId, String reason) {
    if (!status.canTransitionTo(PurchaseOrderStatus.REJECTED)) {
      throw new InvalidTransitionException(ENTITY, id, status, PurchaseOrderStatus.REJECTED);
    }
    String trimmed = InputValidation.requireText("rejectionReason", reason);
    transitionTo(PurchaseOrderStatus.REJECTED);
    this.rejectionReason = trimmed;
    this.approvedBy = approverId;
    this.approvedAt = Instant.now();
  }

  public void markOrdered() {
    transitionTo(PurchaseOrderStatus.ORDERED);
  }

  public void markReceived() {
    transitionTo(PurchaseOrderStatus.RECEIVED);
  }

  public void markInvoiced(String invoiceReference) {
    if (!status.canTransitionTo(PurchaseOrderStatus.INVOICED)) {
      throw new InvalidTransitionException(ENTITY, id, status, PurchaseOrderStatus.INVOICED);
    }
    String reference = InputValidation.requireText("invoiceReference", invoiceReference);
    transitionTo(PurchaseOrderStatus.INVOICED);
    this.invoiceReference = reference;
  }

  private void transitionTo(PurchaseOrderStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidTransitionException(ENTITY, id, status, target);
    }
    this.status = target;
    this.updatedAt = Instant.now();
  }

  // --- Edits ---

  /** Only requested orders may be edited. */
  public void requireEditable(String operation) {
    if (status != PurchaseOrderStatus.REQUESTED) {
      throw InvalidTransitionException.forOperation(ENTITY, id, status, operation);
    }
  }

  public void updateDetails(String label, String unit, String comment) {
    requireEditable("update");
    if (label != null) {
      this.label = InputValidation.requireText("label", label);
    }
    if (unit != null) {
      this.unit = unit;
    }
    if (comment != null) {
      this.comment = comment;
    }
    this.updatedAt = Instant.now();
  }

  /**
   * Changes pricing and, optionally, the purchase type in one step so the reverse-charge rule is
   * checked against the final combination. Null arguments keep the current value.
   */
  public void reprice(
      PurchaseType type, BigDecimal quantity, BigDecimal unitPriceHt, BigDecimal vatRate) {
    requireEditable("update");
    applyPricing(
        type != null ? type : this.type,
        quantity != null ? quantity : this.quantity,
        unitPriceHt != null ? unitPriceHt : this.unitPriceHt,
        vatRate != null ? vatRate : this.vatRate);
    this.updatedAt = Instant.now();
  }

  /**
   * Attaches a supplier. A subcontractor forces the order to SUBCONTRACTING at 0% VAT.
   *
   * @return true if the VAT rate had to be forced to zero
   */
  public boolean assignSupplier(UUID supplierId, boolean subcontractor) {
    this.supplierId = supplierId;
    this.updatedAt = Instant.now();
    if (!subcontractor) {
      return false;
    }
    boolean forced = vatRate.signum() != 0;
    applyPricing(PurchaseType.SUBCONTRACTING, quantity, unitPriceHt, BigDecimal.ZERO);
    return forced;
  }

  public void assignLot(UUID lotId) {
    this.lotId = lotId;
    this.updatedAt = Instant.now();
  }

  public void schedule(LocalDate orderDate, LocalDate expectedDeliveryDate) {
    if (orderDate != null
        && expectedDeliveryDate != null
        && expectedDeliveryDate.isBefore(orderDate)) {
      throw InvalidStateException.forField(
          "expectedDeliveryDate", "Expected delivery date cannot precede the order date");
    }
    this.orderDate = orderDate;
    this.expectedDeliveryDate = expectedDeliveryDate;
    this.updatedAt = Instant.now();
  }

  /** Entry point for external reconciliation. Overrides the nominal total in aggregations. */
  public void applyReconciliation(BigDecimal realAmountHt, LocalDate realInvoiceDate) {
    this.realAmountHt =
        MonetaryCalculator.roundAmount(
            InputValidation.requireNonNegative("realAmountHt", realAmountHt));
    this.realInvoiceDate = realInvoiceDate;
    this.updatedAt = Instant.now();
  }

  public void softDelete(UUID actorId) {
    this.deletedAt = Instant.now();
    this.deletedBy = actorId;
    this.updatedAt = Instant.now();
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  /** Amount used by every aggregation: the reconciled amount when present, else {@code totalHt}. */
  public BigDecimal getEffectiveTotalHt() {
    return realAmountHt != null ? realAmountHt : totalHt;
  }

  /** Key fields by name, for change journaling. */
  public Map<String, Object> snapshot() {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("label", label);
    fields.put("type", type);
    fields.put("supplier_id", supplierId);
    fields.put("lot_id", lotId);
    fields.put("quantity", quantity.stripTrailingZeros().toPlainString());
    fields.put("unit", unit);
    fields.put("unit_price_ht", unitPriceHt.toPlainString());
    fields.put("vat_rate", vatRate.stripTrailingZeros().toPlainString());
    fields.put("order_date", orderDate);
    fields.put("expected_delivery_date", expectedDeliveryDate);
    fields.put("comment", comment);
    return fields;
  }

  private void applyPricing(
      PurchaseType type, BigDecimal quantity, BigDecimal unitPriceHt, BigDecimal vatRate) {
    var qty = InputValidation.requirePositive("quantity", quantity);
    var price = InputValidation.requireNonNegative("unitPriceHt", unitPriceHt);
    var rate = VatRates.requireValid(vatRate);
    requireReverseChargeRate(type, rate);
    this.type = type;
    this.quantity = qty;
    this.unitPriceHt = price;
    this.vatRate = rate;
    this.totalHt = MonetaryCalculator.lineTotal(qty, price);
    this.vatAmount = MonetaryCalculator.vatAmount(totalHt, rate);
    this.totalTtc = totalHt.add(vatAmount);
  }

  private static void requireReverseChargeRate(PurchaseType type, BigDecimal rate) {
    if (type == PurchaseType.SUBCONTRACTING && rate.signum() != 0) {
      throw InvalidStateException.forField(
          "vatRate", "Subcontracting is reverse-charged and must carry a 0% VAT rate");
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getSupplierId() {
    return supplierId;
  }

  public UUID getLotId() {
    return lotId;
  }

  public PurchaseType getType() {
    return type;
  }

  public String getLabel() {
    return label;
  }

  public BigDecimal getQuantity() {
    return quantity;
  }

  public String getUnit() {
    return unit;
  }

  public BigDecimal getUnitPriceHt() {
    return unitPriceHt;
  }

  public BigDecimal getVatRate() {
    return vatRate;
  }

  public BigDecimal getTotalHt() {
    return totalHt;
  }

  public BigDecimal getVatAmount() {
    return vatAmount;
  }

  public BigDecimal getTotalTtc() {
    return totalTtc;
  }

  public LocalDate getOrderDate() {
    return orderDate;
  }

  public LocalDate getExpectedDeliveryDate() {
    return expectedDeliveryDate;
  }

  public PurchaseOrderStatus getStatus() {
    return status;
  }

  public String getInvoiceReference() {
    return invoiceReference;
  }

  public String getRejectionReason() {
    return rejectionReason;
  }

  public String getComment() {
    return comment;
  }

  public UUID getRequestedBy() {
    return requestedBy;
  }

  public UUID getApprovedBy() {
    return approvedBy;
  }

  public Instant getApprovedAt() {
    return approvedAt;
  }

  public BigDecimal getRealAmountHt() {
    return realAmountHt;
  }

  public LocalDate getRealInvoiceDate() {
    return realInvoiceDate;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public UUID getDeletedBy() {
    return deletedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
