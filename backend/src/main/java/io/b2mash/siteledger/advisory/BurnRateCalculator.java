package io.b2mash.siteledger.advisory;

import io.b2mash.siteledger.money.MonetaryCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * Spend-rate arithmetic. Actual burn is measured over elapsed months, but the planned monthly
 * budget is spread over the assumed project duration so young projects are not flagged for
 * front-loaded spending.
 */
@Component
public class BurnRateCalculator {

  private static final BigDecimal DAYS_PER_MONTH = new BigDecimal("30");

  private final Clock clock;
  private final ForecastProperties forecastProperties;

  public BurnRateCalculator(Clock clock, ForecastProperties forecastProperties) {
    this.clock = clock;
    this.forecastProperties = forecastProperties;
  }

  /** Calendar months touched since {@code since}, counting the current one; at least 1. */
  public int elapsedMonths(Instant since) {
    if (since == null) {
      return 1;
    }
    var start = since.atZone(clock.getZone()).toLocalDate();
    var today = LocalDate.now(clock);
    int months =
        (today.getYear() - start.getYear()) * 12
            + (today.getMonthValue() - start.getMonthValue())
            + 1;
    return Math.max(1, months);
  }

  public BigDecimal monthlyBurnRate(BigDecimal realized, Instant since) {
    return MonetaryCalculator.nz(realized)
        .divide(
            BigDecimal.valueOf(elapsedMonths(since)),
            MonetaryCalculator.SCALE,
            MonetaryCalculator.ROUNDING);
  }

  public BigDecimal plannedMonthlyBudget(BigDecimal revised) {
    int duration = Math.max(1, forecastProperties.defaultDurationMonths());
    return MonetaryCalculator.nz(revised)
        .divide(BigDecimal.valueOf(duration), MonetaryCalculator.SCALE, MonetaryCalculator.ROUNDING);
  }

  /**
   * @param remaining budget not yet engaged; may be negative once the envelope is overrun
   */
  public PredictiveIndicators indicators(
      BigDecimal revised, BigDecimal realized, BigDecimal remaining, Instant since) {
    var burnRate = monthlyBurnRate(realized, since);
    var planned = plannedMonthlyBudget(revised);

    var gapPct =
        planned.signum() > 0
            ? MonetaryCalculator.percentOf(burnRate.subtract(planned), planned)
            : BigDecimal.ZERO.setScale(MonetaryCalculator.SCALE);

    BigDecimal monthsRemaining = BigDecimal.ZERO.setScale(MonetaryCalculator.SCALE);
    LocalDate exhaustionDate = null;
    if (burnRate.signum() > 0 && remaining.signum() > 0) {
      var exactMonths = remaining.divide(burnRate, 6, RoundingMode.HALF_UP);
      monthsRemaining = MonetaryCalculator.roundAmount(exactMonths);
      long days = exactMonths.multiply(DAYS_PER_MONTH).longValue();
      exhaustionDate = LocalDate.now(clock).plusDays(days);
    }

    return new PredictiveIndicators(
        burnRate,
        planned,
        gapPct,
        monthsRemaining,
        exhaustionDate,
        MonetaryCalculator.percentOf(realized, revised));
  }
}
