package io.b2mash.siteledger.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once per alert raised by the alert engine. Carries ids and amounts only, no entity
 * references, so listeners can run after the publishing transaction has closed.
 */
public record BudgetThresholdReachedEvent(
    UUID alertId,
    UUID projectId,
    UUID budgetId,
    String alertType,
    BigDecimal budgetAmountHt,
    BigDecimal reachedAmountHt,
    BigDecimal reachedPct,
    BigDecimal thresholdPct,
    Instant occurredAt) {}
