package io.b2mash.siteledger.money;

import io.b2mash.siteledger.exception.InvalidStateException;
import java.math.BigDecimal;
import java.util.List;

/** The closed set of legal VAT rates. Comparison is by value, so {@code 20} equals {@code 20.00}. */
public final class VatRates {

  public static final BigDecimal ZERO = new BigDecimal("0");
  public static final BigDecimal SUPER_REDUCED = new BigDecimal("2.1");
  public static final BigDecimal REDUCED = new BigDecimal("5.5");
  public static final BigDecimal INTERMEDIATE = new BigDecimal("10");
  public static final BigDecimal STANDARD = new BigDecimal("20");

  public static final List<BigDecimal> ALLOWED =
      List.of(ZERO, SUPER_REDUCED, REDUCED, INTERMEDIATE, STANDARD);

  private VatRates() {}

  public static boolean isAllowed(BigDecimal rate) {
    return rate != null && ALLOWED.stream().anyMatch(allowed -> allowed.compareTo(rate) == 0);
  }

  public static BigDecimal requireValid(BigDecimal rate) {
    if (!isAllowed(rate)) {
      throw InvalidStateException.forField(
          "vatRate", "VAT rate " + rate + " is not one of " + ALLOWED);
    }
    return rate;
  }
}
