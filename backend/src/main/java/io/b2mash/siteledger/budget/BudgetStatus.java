package io.b2mash.siteledger.budget;

import io.b2mash.siteledger.money.MonetaryCalculator;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Budget envelope combined with freshly summed engaged and realized purchase amounts. Never
 * persisted.
 */
public record BudgetStatus(
    UUID budgetId,
    UUID projectId,
    BigDecimal initialAmountHt,
    BigDecimal amendmentsAmountHt,
    BigDecimal revisedAmountHt,
    BigDecimal engagedAmountHt,
    BigDecimal realizedAmountHt,
    BigDecimal remainingAmountHt,
    BigDecimal engagedPct,
    BigDecimal realizedPct,
    BigDecimal alertThresholdPct,
    BudgetHealth health) {

  public enum BudgetHealth {
    ON_TRACK,
    AT_RISK,
    OVER_BUDGET;

    /**
     * @param pct consumption percentage (0-100+)
     * @param thresholdPct the budget's alert threshold
     * @return OVER_BUDGET at or above 100, AT_RISK at or above the threshold, ON_TRACK otherwise
     */
    public static BudgetHealth fromPct(BigDecimal pct, BigDecimal thresholdPct) {
      if (pct.compareTo(BigDecimal.valueOf(100)) >= 0) return OVER_BUDGET;
      if (pct.compareTo(thresholdPct) >= 0) return AT_RISK;
      return ON_TRACK;
    }
  }

  public static BudgetStatus compute(Budget budget, BigDecimal engaged, BigDecimal realized) {
    var revised = budget.getRevisedAmountHt();
    var engagedPct = MonetaryCalculator.percentOf(engaged, revised);
    var realizedPct = MonetaryCalculator.percentOf(realized, revised);
    return new BudgetStatus(
        budget.getId(),
        budget.getProjectId(),
        budget.getInitialAmountHt(),
        budget.getAmendmentsAmountHt(),
        revised,
        MonetaryCalculator.roundAmount(engaged),
        MonetaryCalculator.roundAmount(realized),
        revised.subtract(MonetaryCalculator.roundAmount(engaged)),
        engagedPct,
        realizedPct,
        budget.getAlertThresholdPct(),
        BudgetHealth.fromPct(engagedPct, budget.getAlertThresholdPct()));
  }
}
