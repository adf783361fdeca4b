package io.b2mash.siteledger.budget.dto;

import java.math.BigDecimal;

/** Partial update: null fields are left unchanged. */
public record UpdateBudgetRequest(
    BigDecimal initialAmountHt,
    BigDecimal retentionPct,
    BigDecimal alertThresholdPct,
    BigDecimal approvalThresholdHt,
    String notes) {}
