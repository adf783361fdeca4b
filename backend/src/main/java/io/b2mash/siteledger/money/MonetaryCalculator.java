package io.b2mash.siteledger.money;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure monetary arithmetic shared by every ledger. All results are scale 2, {@link
 * RoundingMode#HALF_UP}, matching statutory accounting rounding.
 */
public final class MonetaryCalculator {

  public static final int SCALE = 2;
  public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  private MonetaryCalculator() {}

  public static BigDecimal roundAmount(BigDecimal amount) {
    return nz(amount).setScale(SCALE, ROUNDING);
  }

  public static BigDecimal roundPct(BigDecimal pct) {
    return nz(pct).setScale(SCALE, ROUNDING);
  }

  /** {@code quantity × unitPrice}, rounded. */
  public static BigDecimal lineTotal(BigDecimal quantity, BigDecimal unitPrice) {
    return roundAmount(nz(quantity).multiply(nz(unitPrice)));
  }

  /**
   * VAT on an ex-tax amount.
   *
   * @param amountHt the ex-tax amount
   * @param ratePercent the VAT rate, e.g. 20 for 20%
   */
  public static BigDecimal vatAmount(BigDecimal amountHt, BigDecimal ratePercent) {
    return nz(amountHt).multiply(nz(ratePercent)).divide(HUNDRED, SCALE, ROUNDING);
  }

  public static BigDecimal totalTtc(BigDecimal amountHt, BigDecimal ratePercent) {
    return roundAmount(amountHt).add(vatAmount(amountHt, ratePercent));
  }

  /** Retention held back on the ex-tax amount. */
  public static BigDecimal retentionAmount(BigDecimal amountHt, BigDecimal retentionPct) {
    return nz(amountHt).multiply(nz(retentionPct)).divide(HUNDRED, SCALE, ROUNDING);
  }

  public static BigDecimal netPayable(
      BigDecimal amountHt, BigDecimal vatRate, BigDecimal retentionPct) {
    return totalTtc(amountHt, vatRate).subtract(retentionAmount(amountHt, retentionPct));
  }

  public static InvoiceAmounts invoiceAmounts(
      BigDecimal amountHt, BigDecimal vatRate, BigDecimal retentionPct) {
    var vat = vatAmount(amountHt, vatRate);
    var ttc = roundAmount(amountHt).add(vat);
    var retention = retentionAmount(amountHt, retentionPct);
    return new InvoiceAmounts(roundAmount(amountHt), vat, ttc, retention, ttc.subtract(retention));
  }

  /** {@code part / whole × 100}, or zero when {@code whole} is zero or negative. */
  public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
    if (whole == null || whole.signum() <= 0) {
      return BigDecimal.ZERO.setScale(SCALE);
    }
    return nz(part).multiply(HUNDRED).divide(whole, SCALE, ROUNDING);
  }

  /**
   * Whether {@code part / whole × 100 >= pct}, compared exactly as {@code part × 100 >= pct ×
   * whole} so that no rounding moves a value across the boundary. False when {@code whole} is zero
   * or negative.
   */
  public static boolean reachesPct(BigDecimal part, BigDecimal whole, BigDecimal pct) {
    if (whole == null || whole.signum() <= 0) {
      return false;
    }
    return nz(part).multiply(HUNDRED).compareTo(nz(pct).multiply(whole)) >= 0;
  }

  /** Whether {@code part / whole × 100 > pct}, compared without rounding. */
  public static boolean exceedsPct(BigDecimal part, BigDecimal whole, BigDecimal pct) {
    if (whole == null || whole.signum() <= 0) {
      return false;
    }
    return nz(part).multiply(HUNDRED).compareTo(nz(pct).multiply(whole)) > 0;
  }

  /** Share of general overhead allocated to {@code directCosts}. */
  public static BigDecimal overheadShare(BigDecimal directCosts, BigDecimal coefficientPct) {
    return nz(directCosts).multiply(nz(coefficientPct)).divide(HUNDRED, SCALE, ROUNDING);
  }

  /**
   * Margin over revenue after costs and overhead, as a percentage.
   *
   * @return the margin percentage, or {@code null} when there is no revenue to measure against
   */
  public static BigDecimal marginPct(BigDecimal revenue, BigDecimal costs, BigDecimal overhead) {
    if (revenue == null || revenue.signum() == 0) {
      return null;
    }
    var margin = revenue.subtract(nz(costs)).subtract(nz(overhead));
    return margin.multiply(HUNDRED).divide(revenue, SCALE, ROUNDING);
  }

  /** {@code cost × (1 + margin / 100)}. */
  public static BigDecimal salePrice(BigDecimal cost, BigDecimal marginPct) {
    var factor = BigDecimal.ONE.add(nz(marginPct).divide(HUNDRED, 10, ROUNDING));
    return roundAmount(nz(cost).multiply(factor));
  }

  public static BigDecimal nz(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }
}
