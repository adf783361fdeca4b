package io.b2mash.siteledger.progress;

import io.b2mash.siteledger.exception.InputValidation;
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
 * One lot's billing within a statement. {@code cumulative = contract × progress / 100} and {@code
 * period = cumulative - previousCumulative}; the period may be negative when progress regresses.
 */
@Entity
@Table(name = "progress_statement_lines")
public class ProgressStatementLine {

  static final BigDecimal MAX_PROGRESS = new BigDecimal("100");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "statement_id", nullable = false)
  private UUID statementId;

  @Column(name = "lot_id", nullable = false)
  private UUID lotId;

  @Column(name = "progress_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal progressPct;

  @Column(name = "contract_amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal contractAmountHt;

  @Column(name = "previous_cumulative_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal previousCumulativeHt;

  @Column(name = "cumulative_amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal cumulativeAmountHt;

  @Column(name = "period_amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal periodAmountHt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ProgressStatementLine() {}

  public ProgressStatementLine(
      UUID statementId,
      UUID lotId,
      BigDecimal contractAmountHt,
      BigDecimal previousCumulativeHt,
      BigDecimal progressPct) {
    this.statementId = statementId;
    this.lotId = InputValidation.requirePresent("lotId", lotId);
    this.contractAmountHt = MonetaryCalculator.roundAmount(contractAmountHt);
    this.previousCumulativeHt = MonetaryCalculator.roundAmount(previousCumulativeHt);
    this.createdAt = Instant.now();
    applyProgress(progressPct);
  }

  /** Recomputes cumulative and period amounts, keeping the captured previous cumulative. */
  public void applyProgress(BigDecimal progressPct) {
    this.progressPct =
        InputValidation.requireInRange(
            "progressPct",
            progressPct != null ? progressPct : BigDecimal.ZERO,
            BigDecimal.ZERO,
            MAX_PROGRESS);
    this.cumulativeAmountHt =
        contractAmountHt
            .multiply(this.progressPct)
            .divide(MAX_PROGRESS, MonetaryCalculator.SCALE, MonetaryCalculator.ROUNDING);
    this.periodAmountHt = cumulativeAmountHt.subtract(previousCumulativeHt);
  }

  void attachTo(UUID statementId) {
    this.statementId = statementId;
  }

  public boolean isRegression() {
    return periodAmountHt.signum() < 0;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getStatementId() {
    return statementId;
  }

  public UUID getLotId() {
    return lotId;
  }

  public BigDecimal getProgressPct() {
    return progressPct;
  }

  public BigDecimal getContractAmountHt() {
    return contractAmountHt;
  }

  public BigDecimal getPreviousCumulativeHt() {
    return previousCumulativeHt;
  }

  public BigDecimal getCumulativeAmountHt() {
    return cumulativeAmountHt;
  }

  public BigDecimal getPeriodAmountHt() {
    return periodAmountHt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
