package io.b2mash.siteledger.lot;

import io.b2mash.siteledger.money.MonetaryCalculator;
import java.math.BigDecimal;

/** Detailed cost of a quote-phase lot. Null components count as zero. */
public record CostBreakdown(
    BigDecimal labor,
    BigDecimal materials,
    BigDecimal subcontracting,
    BigDecimal equipment,
    BigDecimal other) {

  public static final CostBreakdown EMPTY = new CostBreakdown(null, null, null, null, null);

  public BigDecimal total() {
    return MonetaryCalculator.roundAmount(
        MonetaryCalculator.nz(labor)
            .add(MonetaryCalculator.nz(materials))
            .add(MonetaryCalculator.nz(subcontracting))
            .add(MonetaryCalculator.nz(equipment))
            .add(MonetaryCalculator.nz(other)));
  }
}
