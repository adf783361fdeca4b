package io.b2mash.siteledger.lot.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.siteledger.lot.BudgetLot;
import io.b2mash.siteledger.lot.LotPhase;
import java.math.BigDecimal;
import java.util.UUID;

public record LotResponse(
    UUID id,
    UUID budgetId,
    UUID quoteId,
    UUID parentLotId,
    LotPhase phase,
    String code,
    String label,
    String unit,
    int position,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal plannedQuantity,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal unitPriceHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal plannedTotalHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal costBreakdownTotal,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal marginPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal salePriceHt) {

  public static LotResponse from(BudgetLot lot) {
    return new LotResponse(
        lot.getId(),
        lot.getBudgetId(),
        lot.getQuoteId(),
        lot.getParentLotId(),
        lot.getPhase(),
        lot.getCode(),
        lot.getLabel(),
        lot.getUnit(),
        lot.getPosition(),
        lot.getPlannedQuantity(),
        lot.getUnitPriceHt(),
        lot.getPlannedTotalHt(),
        lot.getCostBreakdown().total(),
        lot.getMarginPct(),
        lot.getSalePriceHt());
  }
}
