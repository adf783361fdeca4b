package io.b2mash.siteledger.progress.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * @param progressByLot completion percentage per lot id; lots left out are billed at 0%
 * @param retentionPct defaults to the budget's retention when null
 * @param vatRate defaults to 20 when null
 */
public record CreateStatementRequest(
    @NotNull UUID projectId,
    @NotNull UUID budgetId,
    @NotNull LocalDate periodStart,
    @NotNull LocalDate periodEnd,
    BigDecimal retentionPct,
    BigDecimal vatRate,
    Map<UUID, BigDecimal> progressByLot,
    String notes) {}
