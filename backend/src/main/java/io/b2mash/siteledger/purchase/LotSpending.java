package io.b2mash.siteledger.purchase;

import io.b2mash.siteledger.money.MonetaryCalculator;
import java.math.BigDecimal;
import java.util.UUID;

/** Planned versus committed versus spent for one lot. */
public record LotSpending(
    UUID lotId,
    String code,
    String label,
    BigDecimal plannedAmountHt,
    BigDecimal engagedAmountHt,
    BigDecimal realizedAmountHt) {

  /** How far engaged exceeds planned, as a percentage of planned; zero when nothing is planned. */
  public BigDecimal overrunPct() {
    if (plannedAmountHt.signum() <= 0) {
      return BigDecimal.ZERO.setScale(2);
    }
    return MonetaryCalculator.percentOf(
        engagedAmountHt.subtract(plannedAmountHt), plannedAmountHt);
  }
}
