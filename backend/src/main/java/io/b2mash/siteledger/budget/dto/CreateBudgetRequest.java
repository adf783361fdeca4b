package io.b2mash.siteledger.budget.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.UUID;

/** Optional percentages and threshold fall back to the budget defaults when null. */
public record CreateBudgetRequest(
    @NotNull UUID projectId,
    @NotNull @DecimalMin("0") BigDecimal initialAmountHt,
    @DecimalMin("0") @DecimalMax("5") BigDecimal retentionPct,
    @DecimalMin("0") @DecimalMax("200") BigDecimal alertThresholdPct,
    @DecimalMin("0") BigDecimal approvalThresholdHt,
    String notes) {}
