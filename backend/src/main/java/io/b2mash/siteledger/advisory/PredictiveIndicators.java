package io.b2mash.siteledger.advisory;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Spend-rate forecast for a project.
 *
 * @param estimatedExhaustionDate null when spending has not started or the budget is already used
 */
public record PredictiveIndicators(
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal monthlyBurnRate,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal plannedMonthlyBudget,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal burnRateGapPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal monthsOfBudgetRemaining,
    LocalDate estimatedExhaustionDate,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal financialProgressPct) {}
