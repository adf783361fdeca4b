package io.b2mash.siteledger.invoice;

import io.b2mash.siteledger.exception.BusinessRuleException;
import io.b2mash.siteledger.exception.InputValidation;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.InvalidTransitionException;
import io.b2mash.siteledger.money.InvoiceAmounts;
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
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Invoice sent to the client. Derived amounts are stored and recomputed through {@link
 * MonetaryCalculator} whenever the amount or one of the rates changes.
 */
@Entity
@Table(name = "client_invoices")
public class ClientInvoice {

  private static final String ENTITY = "ClientInvoice";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "statement_id")
  private UUID statementId;

  @Column(name = "number", nullable = false, length = 20)
  private String number;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 20)
  private ClientInvoiceType type;

  @Column(name = "amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal amountHt;

  @Column(name = "vat_rate", nullable = false, precision = 5, scale = 2)
  private BigDecimal vatRate;

  @Column(name = "vat_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal vatAmount;

  @Column(name = "total_ttc", nullable = false, precision = 14, scale = 2)
  private BigDecimal totalTtc;

  @Column(name = "retention_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal retentionPct;

  @Column(name = "retention_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal retentionAmount;

  @Column(name = "net_payable", nullable = false, precision = 14, scale = 2)
  private BigDecimal netPayable;

  @Column(name = "issue_date")
  private LocalDate issueDate;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ClientInvoiceStatus status;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "collected_amount", precision = 14, scale = 2)
  private BigDecimal collectedAmount;

  @Column(name = "collection_date")
  private LocalDate collectionDate;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "paid_at")
  private Instant paidAt;

  @Column(name = "cancelled_at")
  private Instant cancelledAt;

  @Version private Long version;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "deleted_by")
  private UUID deletedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ClientInvoice() {}

  public ClientInvoice(
      UUID projectId,
      UUID statementId,
      String number,
      ClientInvoiceType type,
      BigDecimal amountHt,
      BigDecimal vatRate,
      BigDecimal retentionPct,
      UUID createdBy) {
    this.projectId = InputValidation.requirePresent("projectId", projectId);
    this.type = InputValidation.requirePresent("type", type);
    if ((type == ClientInvoiceType.PROGRESS) != (statementId != null)) {
      throw InvalidStateException.forField(
          "statementId", "Exactly the progress invoices are generated from a statement");
    }
    this.statementId = statementId;
    this.number = number;
    this.createdBy = createdBy;
    this.status = ClientInvoiceStatus.DRAFT;
    applyAmounts(amountHt, vatRate, retentionPct);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Draft-only edit. Amount and rates are fixed on invoices generated from a statement. */
  public void updateDraft(
      BigDecimal amountHt,
      BigDecimal vatRate,
      BigDecimal retentionPct,
      LocalDate dueDate,
      String notes) {
    requireDraft("update");
    boolean repricing = amountHt != null || vatRate != null || retentionPct != null;
    if (repricing && statementId != null) {
      throw InvalidStateException.forField(
          "amountHt", "Amounts of an invoice generated from a statement cannot be edited");
    }
    if (repricing) {
      applyAmounts(
          amountHt != null ? amountHt : this.amountHt,
          vatRate != null ? vatRate : this.vatRate,
          retentionPct != null ? retentionPct : this.retentionPct);
    }
    if (dueDate != null) {
      this.dueDate = dueDate;
    }
    if (notes != null) {
      this.notes = notes;
    }
    this.updatedAt = Instant.now();
  }

  public void setDueDate(LocalDate dueDate) {
    this.dueDate = dueDate;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  // --- Transitions ---

  public void issue(LocalDate issueDate) {
    transitionTo(ClientInvoiceStatus.ISSUED);
    this.issueDate = issueDate;
  }

  public void send() {
    transitionTo(ClientInvoiceStatus.SENT);
    this.sentAt = Instant.now();
  }

  public void markPaid() {
    transitionTo(ClientInvoiceStatus.PAID);
    this.paidAt = Instant.now();
  }

  public void cancel() {
    transitionTo(ClientInvoiceStatus.CANCELLED);
    this.cancelledAt = Instant.now();
  }

  /**
   * Adds a collected amount reported by reconciliation. A sent invoice whose running total reaches
   * the net payable becomes paid.
   *
   * @return true if this collection moved the invoice to PAID
   * @throws InvalidStateException if the amount is negative
   * @throws BusinessRuleException if the invoice is cancelled
   */
  public boolean recordCollection(BigDecimal amount, LocalDate collectionDate) {
    if (amount == null || amount.signum() < 0) {
      throw InvalidStateException.forField("amount", "Collected amount cannot be negative");
    }
    if (status == ClientInvoiceStatus.CANCELLED) {
      throw new BusinessRuleException(
          "invoice_cancelled",
          "Invoice cancelled",
          "Cannot record a collection on cancelled invoice " + number);
    }
    this.collectedAmount =
        MonetaryCalculator.nz(collectedAmount).add(MonetaryCalculator.roundAmount(amount));
    this.collectionDate = collectionDate;
    this.updatedAt = Instant.now();
    if (status == ClientInvoiceStatus.SENT && collectedAmount.compareTo(netPayable) >= 0) {
      markPaid();
      return true;
    }
    return false;
  }

  public void softDelete(UUID actorId) {
    requireDraft("delete");
    this.deletedAt = Instant.now();
    this.deletedBy = actorId;
    this.updatedAt = Instant.now();
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  public BigDecimal getOutstandingAmount() {
    return netPayable.subtract(MonetaryCalculator.nz(collectedAmount));
  }

  private void transitionTo(ClientInvoiceStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidTransitionException(ENTITY, id, status, target);
    }
    this.status = target;
    this.updatedAt = Instant.now();
  }

  private void requireDraft(String operation) {
    if (status != ClientInvoiceStatus.DRAFT) {
      throw InvalidTransitionException.forOperation(ENTITY, id, status, operation);
    }
  }

  private void applyAmounts(BigDecimal amountHt, BigDecimal vatRate, BigDecimal retentionPct) {
    var rate = VatRates.requireValid(vatRate);
    var retention = InputValidation.requireRetention(retentionPct);
    InvoiceAmounts amounts =
        MonetaryCalculator.invoiceAmounts(
            InputValidation.requirePresent("amountHt", amountHt), rate, retention);
    this.amountHt = amounts.amountHt();
    this.vatRate = rate;
    this.retentionPct = retention;
    this.vatAmount = amounts.vatAmount();
    this.totalTtc = amounts.totalTtc();
    this.retentionAmount = amounts.retentionAmount();
    this.netPayable = amounts.netPayable();
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getStatementId() {
    return statementId;
  }

  public String getNumber() {
    return number;
  }

  public ClientInvoiceType getType() {
    return type;
  }

  public BigDecimal getAmountHt() {
    return amountHt;
  }

  public BigDecimal getVatRate() {
    return vatRate;
  }

  public BigDecimal getVatAmount() {
    return vatAmount;
  }

  public BigDecimal getTotalTtc() {
    return totalTtc;
  }

  public BigDecimal getRetentionPct() {
    return retentionPct;
  }

  public BigDecimal getRetentionAmount() {
    return retentionAmount;
  }

  public BigDecimal getNetPayable() {
    return netPayable;
  }

  public LocalDate getIssueDate() {
    return issueDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public ClientInvoiceStatus getStatus() {
    return status;
  }

  public String getNotes() {
    return notes;
  }

  public BigDecimal getCollectedAmount() {
    return collectedAmount;
  }

  public LocalDate getCollectionDate() {
    return collectionDate;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getPaidAt() {
    return paidAt;
  }

  public Instant getCancelledAt() {
    return cancelledAt;
  }

  public Long getVersion() {
    return version;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
