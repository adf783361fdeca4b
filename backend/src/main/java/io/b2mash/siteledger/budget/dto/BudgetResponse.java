package io.b2mash.siteledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.siteledger.budget.Budget;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record BudgetResponse(
    UUID id,
    UUID projectId,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal initialAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal amendmentsAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal revisedAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal retentionPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal alertThresholdPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal approvalThresholdHt,
    String notes,
    Instant createdAt,
    Instant updatedAt) {

  public static BudgetResponse from(Budget budget) {
    return new BudgetResponse(
        budget.getId(),
        budget.getProjectId(),
        budget.getInitialAmountHt(),
        budget.getAmendmentsAmountHt(),
        budget.getRevisedAmountHt(),
        budget.getRetentionPct(),
        budget.getAlertThresholdPct(),
        budget.getApprovalThresholdHt(),
        budget.getNotes(),
        budget.getCreatedAt(),
        budget.getUpdatedAt());
  }
}
