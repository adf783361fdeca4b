package io.b2mash.siteledger.exception;

import java.math.BigDecimal;

/** Argument checks that raise {@link InvalidStateException} naming the offending field. */
public final class InputValidation {

  public static final BigDecimal MAX_RETENTION_PCT = new BigDecimal("5");

  private InputValidation() {}

  public static BigDecimal requireInRange(
      String field, BigDecimal value, BigDecimal min, BigDecimal max) {
    if (value == null) {
      throw InvalidStateException.forField(field, field + " is required");
    }
    if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
      throw InvalidStateException.forField(
          field, field + " must be between " + min + " and " + max + ", got " + value);
    }
    return value;
  }

  /** Retention is capped at 5% by statute. */
  public static BigDecimal requireRetention(BigDecimal retentionPct) {
    return requireInRange("retentionPct", retentionPct, BigDecimal.ZERO, MAX_RETENTION_PCT);
  }

  public static BigDecimal requireNonNegative(String field, BigDecimal value) {
    if (value == null || value.signum() < 0) {
      throw InvalidStateException.forField(field, field + " must be zero or positive");
    }
    return value;
  }

  public static BigDecimal requirePositive(String field, BigDecimal value) {
    if (value == null || value.signum() <= 0) {
      throw InvalidStateException.forField(field, field + " must be greater than zero");
    }
    return value;
  }

  public static String requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      throw InvalidStateException.forField(field, field + " is required");
    }
    return value.trim();
  }

  public static <T> T requirePresent(String field, T value) {
    if (value == null) {
      throw InvalidStateException.forField(field, field + " is required");
    }
    return value;
  }
}
