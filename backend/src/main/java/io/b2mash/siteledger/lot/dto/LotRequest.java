package io.b2mash.siteledger.lot.dto;

import io.b2mash.siteledger.lot.CostBreakdown;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Lot creation or partial update. On creation exactly one of {@code budgetId} and {@code quoteId}
 * must be set; on update both are ignored.
 */
public record LotRequest(
    UUID budgetId,
    UUID quoteId,
    UUID parentLotId,
    String code,
    String label,
    String unit,
    BigDecimal plannedQuantity,
    BigDecimal unitPriceHt,
    Integer position,
    CostBreakdown costBreakdown,
    BigDecimal marginPct) {}
