package io.b2mash.siteledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.siteledger.budget.AmendmentStatus;
import io.b2mash.siteledger.budget.BudgetAmendment;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record AmendmentResponse(
    UUID id,
    UUID budgetId,
    String number,
    String reason,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal amountHt,
    String impactDescription,
    AmendmentStatus status,
    UUID validatedBy,
    Instant validatedAt,
    Instant createdAt) {

  public static AmendmentResponse from(BudgetAmendment amendment) {
    return new AmendmentResponse(
        amendment.getId(),
        amendment.getBudgetId(),
        amendment.getNumber(),
        amendment.getReason(),
        amendment.getAmountHt(),
        amendment.getImpactDescription(),
        amendment.getStatus(),
        amendment.getValidatedBy(),
        amendment.getValidatedAt(),
        amendment.getCreatedAt());
  }
}
