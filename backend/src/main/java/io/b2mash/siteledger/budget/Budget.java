package io.b2mash.siteledger.budget;

import io.b2mash.siteledger.exception.BusinessRuleException;
import io.b2mash.siteledger.exception.InputValidation;
import io.b2mash.siteledger.money.MonetaryCalculator;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Financial envelope of a project. {@code amendmentsAmountHt} is never incremented: it is replaced
 * with the sum of validated amendments each time that sum may have changed.
 */
@Entity
@Table(name = "budgets")
public class Budget {

  public static final BigDecimal DEFAULT_RETENTION_PCT = new BigDecimal("5.00");
  public static final BigDecimal DEFAULT_ALERT_THRESHOLD_PCT = new BigDecimal("90.00");
  public static final BigDecimal DEFAULT_APPROVAL_THRESHOLD_HT = new BigDecimal("5000.00");

  static final BigDecimal MAX_ALERT_THRESHOLD_PCT = new BigDecimal("200");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "initial_amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal initialAmountHt;

  @Column(name = "amendments_amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal amendmentsAmountHt = BigDecimal.ZERO;

  @Column(name = "retention_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal retentionPct;

  @Column(name = "alert_threshold_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal alertThresholdPct;

  @Column(name = "approval_threshold_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal approvalThresholdHt;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Version private Long version;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "deleted_by")
  private UUID deletedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Budget() {}

  public Budget(
      UUID projectId,
      BigDecimal initialAmountHt,
      BigDecimal retentionPct,
      BigDecimal alertThresholdPct,
      BigDecimal approvalThresholdHt,
      String notes) {
    this.projectId = InputValidation.requirePresent("projectId", projectId);
    applySettings(initialAmountHt, retentionPct, alertThresholdPct, approvalThresholdHt, notes);
    this.amendmentsAmountHt = BigDecimal.ZERO.setScale(2);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Direct edit of the envelope settings. The revised amount may not end up negative. */
  public void updateSettings(
      BigDecimal initialAmountHt,
      BigDecimal retentionPct,
      BigDecimal alertThresholdPct,
      BigDecimal approvalThresholdHt,
      String notes) {
    var initial = initialAmountHt != null ? initialAmountHt : this.initialAmountHt;
    requireNonNegativeRevised(initial, amendmentsAmountHt);
    applySettings(
        initial,
        retentionPct != null ? retentionPct : this.retentionPct,
        alertThresholdPct != null ? alertThresholdPct : this.alertThresholdPct,
        approvalThresholdHt != null ? approvalThresholdHt : this.approvalThresholdHt,
        notes != null ? notes : this.notes);
    this.updatedAt = Instant.now();
  }

  /**
   * Replaces the amendment total with a freshly summed value.
   *
   * @throws BusinessRuleException if {@code initial + validatedAmendmentsSum} would be negative
   */
  public void applyAmendmentTotal(BigDecimal validatedAmendmentsSum) {
    var sum = MonetaryCalculator.roundAmount(validatedAmendmentsSum);
    requireNonNegativeRevised(initialAmountHt, sum);
    this.amendmentsAmountHt = sum;
    this.updatedAt = Instant.now();
  }

  public BigDecimal getRevisedAmountHt() {
    return MonetaryCalculator.roundAmount(initialAmountHt.add(amendmentsAmountHt));
  }

  /** Boundary inclusive: an order exactly at the threshold needs approval. */
  public boolean needsApproval(BigDecimal amountHt) {
    return MonetaryCalculator.nz(amountHt).compareTo(approvalThresholdHt) >= 0;
  }

  public void softDelete(UUID actorId) {
    this.deletedAt = Instant.now();
    this.deletedBy = actorId;
    this.updatedAt = Instant.now();
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  static void requireNonNegativeRevised(BigDecimal initial, BigDecimal amendments) {
    if (initial.add(amendments).signum() < 0) {
      throw new BusinessRuleException(
          "negative_revised_budget",
          "Budget would become negative",
          "Initial amount "
              + initial
              + " with amendments "
              + amendments
              + " gives a negative revised budget");
    }
  }

  private void applySettings(
      BigDecimal initialAmountHt,
      BigDecimal retentionPct,
      BigDecimal alertThresholdPct,
      BigDecimal approvalThresholdHt,
      String notes) {
    this.initialAmountHt =
        MonetaryCalculator.roundAmount(
            InputValidation.requireNonNegative("initialAmountHt", initialAmountHt));
    this.retentionPct =
        InputValidation.requireRetention(
            retentionPct != null ? retentionPct : DEFAULT_RETENTION_PCT);
    this.alertThresholdPct =
        InputValidation.requireInRange(
            "alertThresholdPct",
            alertThresholdPct != null ? alertThresholdPct : DEFAULT_ALERT_THRESHOLD_PCT,
            BigDecimal.ZERO,
            MAX_ALERT_THRESHOLD_PCT);
    this.approvalThresholdHt =
        InputValidation.requireNonNegative(
            "approvalThresholdHt",
            approvalThresholdHt != null ? approvalThresholdHt : DEFAULT_APPROVAL_THRESHOLD_HT);
    this.notes = notes;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public BigDecimal getInitialAmountHt() {
    return initialAmountHt;
  }

  public BigDecimal getAmendmentsAmountHt() {
    return amendmentsAmountHt;
  }

  public BigDecimal getRetentionPct() {
    return retentionPct;
  }

  public BigDecimal getAlertThresholdPct() {
    return alertThresholdPct;
  }

  public BigDecimal getApprovalThresholdHt() {
    return approvalThresholdHt;
  }

  public String getNotes() {
    return notes;
  }

  public Long getVersion() {
    return version;
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
