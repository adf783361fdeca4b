package io.b2mash.siteledger.progress;

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
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Periodic cumulative billing statement. Header totals are always the sum of the line amounts;
 * retention, VAT, TTC and net payable derive from the cumulative HT total.
 */
@Entity
@Table(name = "progress_statements")
public class ProgressStatement {

  private static final String ENTITY = "ProgressStatement";

  public static final BigDecimal DEFAULT_VAT_RATE = VatRates.STANDARD;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "budget_id", nullable = false)
  private UUID budgetId;

  @Column(name = "number", nullable = false, length = 20)
  private String number;

  @Column(name = "period_start", nullable = false)
  private LocalDate periodStart;

  @Column(name = "period_end", nullable = false)
  private LocalDate periodEnd;

  @Column(name = "retention_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal retentionPct;

  @Column(name = "vat_rate", nullable = false, precision = 5, scale = 2)
  private BigDecimal vatRate;

  @Column(name = "previous_cumulative_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal previousCumulativeHt = BigDecimal.ZERO;

  @Column(name = "period_amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal periodAmountHt = BigDecimal.ZERO;

  @Column(name = "cumulative_amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal cumulativeAmountHt = BigDecimal.ZERO;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 30)
  private ProgressStatementStatus status;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "validated_by")
  private UUID validatedBy;

  @Column(name = "validated_at")
  private Instant validatedAt;

  @Column(name = "client_validated_at")
  private Instant clientValidatedAt;

  @Column(name = "invoiced_at")
  private Instant invoicedAt;

  @Version private Long version;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "deleted_by")
  private UUID deletedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ProgressStatement() {}

  public ProgressStatement(
      UUID projectId,
      UUID budgetId,
      String number,
      LocalDate periodStart,
      LocalDate periodEnd,
      BigDecimal retentionPct,
      BigDecimal vatRate,
      UUID createdBy) {
    this.projectId = InputValidation.requirePresent("projectId", projectId);
    this.budgetId = InputValidation.requirePresent("budgetId", budgetId);
    this.number = number;
    applyPeriod(periodStart, periodEnd);
    this.retentionPct = InputValidation.requireRetention(retentionPct);
    this.vatRate = VatRates.requireValid(vatRate != null ? vatRate : DEFAULT_VAT_RATE);
    this.createdBy = createdBy;
    this.status = ProgressStatementStatus.DRAFT;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Replaces header totals with the sums of {@code lines}. */
  public void recomputeTotals(List<ProgressStatementLine> lines) {
    this.previousCumulativeHt = sum(lines, ProgressStatementLine::getPreviousCumulativeHt);
    this.cumulativeAmountHt = sum(lines, ProgressStatementLine::getCumulativeAmountHt);
    this.periodAmountHt = sum(lines, ProgressStatementLine::getPeriodAmountHt);
    this.updatedAt = Instant.now();
  }

  public void updateHeader(
      LocalDate periodStart,
      LocalDate periodEnd,
      BigDecimal retentionPct,
      BigDecimal vatRate,
      String notes) {
    requireDraft("update");
    applyPeriod(
        periodStart != null ? periodStart : this.periodStart,
        periodEnd != null ? periodEnd : this.periodEnd);
    if (retentionPct != null) {
      this.retentionPct = InputValidation.requireRetention(retentionPct);
    }
    if (vatRate != null) {
      this.vatRate = VatRates.requireValid(vatRate);
    }
    if (notes != null) {
      this.notes = notes;
    }
    this.updatedAt = Instant.now();
  }

  public void setNotes(String notes) {
    requireDraft("update notes");
    this.notes = notes;
    this.updatedAt = Instant.now();
  }

  // --- Transitions ---

  public void submitForReview() {
    transitionTo(ProgressStatementStatus.SUBMITTED_FOR_REVIEW);
  }

  /** Internal validation: stamps the validator. */
  public void issue(UUID validatorId) {
    transitionTo(ProgressStatementStatus.ISSUED);
    this.validatedBy = validatorId;
    this.validatedAt = Instant.now();
  }

  public void markClientValidated() {
    transitionTo(ProgressStatementStatus.CLIENT_VALIDATED);
    this.clientValidatedAt = Instant.now();
  }

  /** @param invoicedAt billing timestamp; defaults to now when null */
  public void markInvoiced(Instant invoicedAt) {
    transitionTo(ProgressStatementStatus.INVOICED);
    this.invoicedAt = invoicedAt != null ? invoicedAt : Instant.now();
  }

  private void transitionTo(ProgressStatementStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidTransitionException(ENTITY, id, status, target);
    }
    this.status = target;
    this.updatedAt = Instant.now();
  }

  public void requireDraft(String operation) {
    if (status != ProgressStatementStatus.DRAFT) {
      throw InvalidTransitionException.forOperation(ENTITY, id, status, operation);
    }
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

  // --- Derived amounts ---

  public InvoiceAmounts getAmounts() {
    return MonetaryCalculator.invoiceAmounts(cumulativeAmountHt, vatRate, retentionPct);
  }

  public BigDecimal getRetentionAmount() {
    return getAmounts().retentionAmount();
  }

  public BigDecimal getVatAmount() {
    return getAmounts().vatAmount();
  }

  public BigDecimal getTotalTtc() {
    return getAmounts().totalTtc();
  }

  public BigDecimal getNetPayable() {
    return getAmounts().netPayable();
  }

  private void applyPeriod(LocalDate periodStart, LocalDate periodEnd) {
    InputValidation.requirePresent("periodStart", periodStart);
    InputValidation.requirePresent("periodEnd", periodEnd);
    if (periodEnd.isBefore(periodStart)) {
      throw InvalidStateException.forField(
          "periodEnd", "Period end " + periodEnd + " precedes period start " + periodStart);
    }
    this.periodStart = periodStart;
    this.periodEnd = periodEnd;
  }

  private static BigDecimal sum(
      List<ProgressStatementLine> lines,
      Function<ProgressStatementLine, BigDecimal> amount) {
    return MonetaryCalculator.roundAmount(
        lines.stream().map(amount).reduce(BigDecimal.ZERO, BigDecimal::add));
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getBudgetId() {
    return budgetId;
  }

  public String getNumber() {
    return number;
  }

  public LocalDate getPeriodStart() {
    return periodStart;
  }

  public LocalDate getPeriodEnd() {
    return periodEnd;
  }

  public BigDecimal getRetentionPct() {
    return retentionPct;
  }

  public BigDecimal getVatRate() {
    return vatRate;
  }

  public BigDecimal getPreviousCumulativeHt() {
    return previousCumulativeHt;
  }

  public BigDecimal getPeriodAmountHt() {
    return periodAmountHt;
  }

  public BigDecimal getCumulativeAmountHt() {
    return cumulativeAmountHt;
  }

  public ProgressStatementStatus getStatus() {
    return status;
  }

  public String getNotes() {
    return notes;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public UUID getValidatedBy() {
    return validatedBy;
  }

  public Instant getValidatedAt() {
    return validatedAt;
  }

  public Instant getClientValidatedAt() {
    return clientValidatedAt;
  }

  public Instant getInvoicedAt() {
    return invoicedAt;
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
