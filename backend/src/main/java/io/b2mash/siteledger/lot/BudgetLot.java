package io.b2mash.siteledger.lot;

import io.b2mash.siteledger.exception.InputValidation;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.money.MonetaryCalculator;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Cost line of a budget (site phase) or of a quote (pre-sale phase), never both. Purchase orders
 * and progress statement lines point at lots.
 */
@Entity
@Table(name = "budget_lots")
public class BudgetLot {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "budget_id")
  private UUID budgetId;

  @Column(name = "quote_id")
  private UUID quoteId;

  @Column(name = "parent_lot_id")
  private UUID parentLotId;

  @Column(name = "code", nullable = false, length = 20)
  private String code;

  @Column(name = "label", nullable = false, length = 255)
  private String label;

  @Column(name = "unit", length = 20)
  private String unit;

  @Column(name = "planned_quantity", nullable = false, precision = 12, scale = 3)
  private BigDecimal plannedQuantity;

  @Column(name = "unit_price_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal unitPriceHt;

  @Column(name = "planned_total_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal plannedTotalHt;

  @Column(name = "position", nullable = false)
  private int position;

  @Column(name = "labor_cost", precision = 14, scale = 2)
  private BigDecimal laborCost;

  @Column(name = "materials_cost", precision = 14, scale = 2)
  private BigDecimal materialsCost;

  @Column(name = "subcontracting_cost", precision = 14, scale = 2)
  private BigDecimal subcontractingCost;

  @Column(name = "equipment_cost", precision = 14, scale = 2)
  private BigDecimal equipmentCost;

  @Column(name = "other_cost", precision = 14, scale = 2)
  private BigDecimal otherCost;

  @Column(name = "margin_pct", precision = 5, scale = 2)
  private BigDecimal marginPct;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "deleted_by")
  private UUID deletedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BudgetLot() {}

  /**
   * @throws InvalidStateException unless exactly one of {@code budgetId} and {@code quoteId} is set
   */
  public BudgetLot(
      UUID budgetId,
      UUID quoteId,
      String code,
      String label,
      BigDecimal plannedQuantity,
      BigDecimal unitPriceHt) {
    if ((budgetId == null) == (quoteId == null)) {
      throw new InvalidStateException(
          "Invalid lot owner",
          "A lot belongs to exactly one budget or one quote, never both and never neither",
          budgetId == null ? "budgetId" : "quoteId");
    }
    this.budgetId = budgetId;
    this.quoteId = quoteId;
    this.code = InputValidation.requireText("code", code);
    this.label = InputValidation.requireText("label", label);
    applyPricing(plannedQuantity, unitPriceHt);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateDetails(
      String code,
      String label,
      String unit,
      BigDecimal plannedQuantity,
      BigDecimal unitPriceHt,
      Integer position) {
    if (code != null) {
      this.code = InputValidation.requireText("code", code);
    }
    if (label != null) {
      this.label = InputValidation.requireText("label", label);
    }
    if (unit != null) {
      this.unit = unit;
    }
    applyPricing(
        plannedQuantity != null ? plannedQuantity : this.plannedQuantity,
        unitPriceHt != null ? unitPriceHt : this.unitPriceHt);
    if (position != null) {
      this.position = position;
    }
    this.updatedAt = Instant.now();
  }

  public void setUnit(String unit) {
    this.unit = unit;
  }

  public void setPosition(int position) {
    this.position = position;
  }

  public void setParentLotId(UUID parentLotId) {
    this.parentLotId = parentLotId;
    this.updatedAt = Instant.now();
  }

  /**
   * Quote-phase pricing detail.
   *
   * @throws InvalidStateException on a site lot, which is priced by quantity and unit price only
   */
  public void setCostBreakdown(CostBreakdown breakdown, BigDecimal marginPct) {
    if (getPhase() != LotPhase.QUOTE) {
      throw InvalidStateException.forField(
          "costBreakdown", "Cost breakdown and margin only apply to quote lots");
    }
    var costs = breakdown != null ? breakdown : CostBreakdown.EMPTY;
    this.laborCost = costs.labor();
    this.materialsCost = costs.materials();
    this.subcontractingCost = costs.subcontracting();
    this.equipmentCost = costs.equipment();
    this.otherCost = costs.other();
    this.marginPct = marginPct;
    this.updatedAt = Instant.now();
  }

  public CostBreakdown getCostBreakdown() {
    return new CostBreakdown(laborCost, materialsCost, subcontractingCost, equipmentCost, otherCost);
  }

  /**
   * {@code breakdown × (1 + margin / 100)}.
   *
   * @return the computed sale price, or {@code null} on a site lot, when there is no margin or
   *     when the breakdown sums to zero
   */
  public BigDecimal getSalePriceHt() {
    if (getPhase() != LotPhase.QUOTE) {
      return null;
    }
    var cost = getCostBreakdown().total();
    if (marginPct == null || cost.signum() == 0) {
      return null;
    }
    return MonetaryCalculator.salePrice(cost, marginPct);
  }

  public LotPhase getPhase() {
    return quoteId != null ? LotPhase.QUOTE : LotPhase.SITE;
  }

  /** Budget or quote id, whichever owns this lot. */
  public UUID getOwnerId() {
    return budgetId != null ? budgetId : quoteId;
  }

  public void softDelete(UUID actorId) {
    this.deletedAt = Instant.now();
    this.deletedBy = actorId;
    this.updatedAt = Instant.now();
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  private void applyPricing(BigDecimal plannedQuantity, BigDecimal unitPriceHt) {
    this.plannedQuantity =
        InputValidation.requireNonNegative(
            "plannedQuantity", plannedQuantity != null ? plannedQuantity : BigDecimal.ZERO);
    this.unitPriceHt =
        InputValidation.requireNonNegative(
            "unitPriceHt", unitPriceHt != null ? unitPriceHt : BigDecimal.ZERO);
    this.plannedTotalHt = MonetaryCalculator.lineTotal(this.plannedQuantity, this.unitPriceHt);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getBudgetId() {
    return budgetId;
  }

  public UUID getQuoteId() {
    return quoteId;
  }

  public UUID getParentLotId() {
    return parentLotId;
  }

  public String getCode() {
    return code;
  }

  public String getLabel() {
    return label;
  }

  public String getUnit() {
    return unit;
  }

  public BigDecimal getPlannedQuantity() {
    return plannedQuantity;
  }

  public BigDecimal getUnitPriceHt() {
    return unitPriceHt;
  }

  public BigDecimal getPlannedTotalHt() {
    return plannedTotalHt;
  }

  public int getPosition() {
    return position;
  }

  public BigDecimal getMarginPct() {
    return marginPct;
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
