package io.b2mash.siteledger.alert.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.siteledger.alert.BudgetAlert;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * @param type the alert's stable code, e.g. {@code seuil_engage}
 */
public record AlertResponse(
    UUID id,
    UUID projectId,
    UUID budgetId,
    String type,
    String message,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal reachedPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal thresholdPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal budgetAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal reachedAmountHt,
    boolean acknowledged,
    UUID acknowledgedBy,
    Instant acknowledgedAt,
    Instant createdAt) {

  public static AlertResponse from(BudgetAlert alert) {
    return new AlertResponse(
        alert.getId(),
        alert.getProjectId(),
        alert.getBudgetId(),
        alert.getType().code(),
        alert.getMessage(),
        alert.getReachedPct(),
        alert.getThresholdPct(),
        alert.getBudgetAmountHt(),
        alert.getReachedAmountHt(),
        alert.isAcknowledged(),
        alert.getAcknowledgedBy(),
        alert.getAcknowledgedAt(),
        alert.getCreatedAt());
  }
}
