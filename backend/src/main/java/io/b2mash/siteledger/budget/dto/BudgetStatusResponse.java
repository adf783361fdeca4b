package io.b2mash.siteledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.siteledger.budget.BudgetStatus;
import io.b2mash.siteledger.budget.BudgetStatus.BudgetHealth;
import java.math.BigDecimal;
import java.util.UUID;

public record BudgetStatusResponse(
    UUID budgetId,
    UUID projectId,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal initialAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal amendmentsAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal revisedAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal engagedAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal realizedAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal remainingAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal engagedPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal realizedPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal alertThresholdPct,
    BudgetHealth health) {

  public static BudgetStatusResponse from(BudgetStatus status) {
    return new BudgetStatusResponse(
        status.budgetId(),
        status.projectId(),
        status.initialAmountHt(),
        status.amendmentsAmountHt(),
        status.revisedAmountHt(),
        status.engagedAmountHt(),
        status.realizedAmountHt(),
        status.remainingAmountHt(),
        status.engagedPct(),
        status.realizedPct(),
        status.alertThresholdPct(),
        status.health());
  }
}
