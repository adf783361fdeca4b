package io.b2mash.siteledger.advisory;

import io.b2mash.siteledger.budget.Budget;
import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.money.MonetaryCalculator;
import io.b2mash.siteledger.purchase.LotSpending;
import io.b2mash.siteledger.purchase.PurchaseAggregationService;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Produces up to five financial suggestions for a project from deterministic rules, merged with
 * the external advisor's output when one is configured, plus spend-rate indicators.
 */
@Service
public class FinancialSuggestionService {

  private static final Logger log = LoggerFactory.getLogger(FinancialSuggestionService.class);

  static final BigDecimal ENGAGED_CRITICAL_PCT = new BigDecimal("90");
  static final BigDecimal MARGIN_CRITICAL_PCT = new BigDecimal("10");
  static final BigDecimal REALIZED_AHEAD_POINTS = new BigDecimal("10");
  static final BigDecimal LOT_OVERRUN_FACTOR = new BigDecimal("1.3");
  static final BigDecimal BURN_RATE_FACTOR = new BigDecimal("1.2");

  private final BudgetRepository budgetRepository;
  private final PurchaseAggregationService aggregationService;
  private final BurnRateCalculator burnRateCalculator;
  private final AdvisoryProvider advisoryProvider;
  private final AdvisoryProperties advisoryProperties;
  private final ForecastProperties forecastProperties;

  public FinancialSuggestionService(
      BudgetRepository budgetRepository,
      PurchaseAggregationService aggregationService,
      BurnRateCalculator burnRateCalculator,
      AdvisoryProvider advisoryProvider,
      AdvisoryProperties advisoryProperties,
      ForecastProperties forecastProperties) {
    this.budgetRepository = budgetRepository;
    this.aggregationService = aggregationService;
    this.burnRateCalculator = burnRateCalculator;
    this.advisoryProvider = advisoryProvider;
    this.advisoryProperties = advisoryProperties;
    this.forecastProperties = forecastProperties;
  }

  @Transactional(readOnly = true)
  public FinancialSuggestions suggest(UUID projectId) {
    var budget =
        budgetRepository
            .findLiveByProjectId(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Budget", projectId));

    var snapshot = snapshot(budget);
    var rules = applyRules(budget, snapshot);
    int max = advisoryProperties.maxSuggestions();

    var suggestions = SuggestionMerger.sortAndCap(rules, max);
    boolean advisoryUsed = false;
    var external = askAdvisor(projectId, snapshot);
    if (!external.isEmpty()) {
      suggestions = SuggestionMerger.merge(external, rules, max);
      advisoryUsed = true;
      log.info(
          "Merged suggestions for project {}: {} advisory + {} rules -> {}",
          projectId,
          external.size(),
          rules.size(),
          suggestions.size());
    }

    var indicators =
        burnRateCalculator.indicators(
            snapshot.revised(), snapshot.realized(), snapshot.remaining(), budget.getCreatedAt());
    return new FinancialSuggestions(
        projectId,
        suggestions,
        indicators,
        advisoryUsed,
        advisoryUsed ? FinancialSuggestions.SOURCE_ADVISORY : FinancialSuggestions.SOURCE_RULES);
  }

  private Snapshot snapshot(Budget budget) {
    var revised = budget.getRevisedAmountHt();
    var engaged = aggregationService.engagedAmount(budget.getProjectId());
    var realized = aggregationService.realizedAmount(budget.getProjectId());
    var remaining = revised.subtract(engaged);
    var burnRate = burnRateCalculator.monthlyBurnRate(realized, budget.getCreatedAt());
    return new Snapshot(
        revised,
        engaged,
        realized,
        remaining,
        MonetaryCalculator.percentOf(engaged, revised),
        MonetaryCalculator.percentOf(realized, revised),
        MonetaryCalculator.percentOf(remaining, revised),
        burnRate,
        burnRateCalculator.plannedMonthlyBudget(revised));
  }

  private List<Suggestion> applyRules(Budget budget, Snapshot s) {
    var suggestions = new ArrayList<Suggestion>();

    // rules compare the exact ratios, the rounded percentages are display values only
    if (MonetaryCalculator.exceedsPct(s.engaged(), s.revised(), ENGAGED_CRITICAL_PCT)
        && !MonetaryCalculator.reachesPct(s.remaining(), s.revised(), MARGIN_CRITICAL_PCT)) {
      var shortfall = s.remaining().signum() < 0 ? s.remaining().negate() : BigDecimal.ZERO;
      suggestions.add(
          new Suggestion(
              SuggestionType.CREATE_AMENDMENT,
              SuggestionSeverity.CRITICAL,
              "Raise a budget amendment",
              "The budget is "
                  + s.engagedPct().toPlainString()
                  + "% engaged with only "
                  + s.marginPct().toPlainString()
                  + "% left. An amendment is recommended to secure the project.",
              MonetaryCalculator.roundAmount(shortfall)));
    }

    if (MonetaryCalculator.exceedsPct(
        s.realized().subtract(s.engaged()), s.revised(), REALIZED_AHEAD_POINTS)) {
      suggestions.add(
          new Suggestion(
              SuggestionType.REDUCE_COSTS,
              SuggestionSeverity.WARNING,
              "Realized spending ahead of commitments",
              "Realized ("
                  + s.realizedPct().toPlainString()
                  + "%) exceeds engaged ("
                  + s.engagedPct().toPlainString()
                  + "%) by more than 10 points. Check for unplanned billing.",
              MonetaryCalculator.roundAmount(s.realized().subtract(s.engaged()).abs())));
    }

    for (LotSpending lot : aggregationService.lotBreakdown(budget.getId())) {
      var planned = lot.plannedAmountHt();
      if (planned.signum() > 0
          && lot.engagedAmountHt().compareTo(planned.multiply(LOT_OVERRUN_FACTOR)) > 0) {
        suggestions.add(
            new Suggestion(
                SuggestionType.OPTIMIZE_LOTS,
                SuggestionSeverity.WARNING,
                "Lot " + lot.code() + " over plan",
                "Lot "
                    + lot.code()
                    + " ("
                    + lot.label()
                    + ") exceeds its plan by "
                    + lot.overrunPct().toPlainString()
                    + "%. Engaged: "
                    + lot.engagedAmountHt().toPlainString()
                    + ", planned: "
                    + planned.toPlainString()
                    + ".",
                MonetaryCalculator.roundAmount(lot.engagedAmountHt().subtract(planned))));
      }
    }

    if (s.plannedMonthly().signum() > 0
        && s.burnRate().compareTo(s.plannedMonthly().multiply(BURN_RATE_FACTOR)) > 0) {
      suggestions.add(
          new Suggestion(
              SuggestionType.ALERT_BURN_RATE,
              SuggestionSeverity.WARNING,
              "Spending rate too high",
              "The monthly burn rate ("
                  + s.burnRate().toPlainString()
                  + "/month) is more than 20% above the planned monthly budget ("
                  + s.plannedMonthly().toPlainString()
                  + "/month).",
              s.burnRate().subtract(s.plannedMonthly())));
    }

    if (s.revised().compareTo(forecastProperties.largeProjectThreshold()) > 0) {
      suggestions.add(
          new Suggestion(
              SuggestionType.CREATE_PROGRESS_STATEMENT,
              SuggestionSeverity.INFO,
              "Issue a progress statement",
              "The budget exceeds "
                  + forecastProperties.largeProjectThreshold().toPlainString()
                  + ". Issue progress statements regularly to track financial progress.",
              BigDecimal.ZERO.setScale(MonetaryCalculator.SCALE)));
    }

    return suggestions;
  }

  private List<Suggestion> askAdvisor(UUID projectId, Snapshot s) {
    var kpis = new LinkedHashMap<String, String>();
    kpis.put("revised_amount_ht", s.revised().toPlainString());
    kpis.put("engaged_amount_ht", s.engaged().toPlainString());
    kpis.put("realized_amount_ht", s.realized().toPlainString());
    kpis.put("engaged_pct", s.engagedPct().toPlainString());
    kpis.put("realized_pct", s.realizedPct().toPlainString());
    kpis.put("budget_margin_pct", s.marginPct().toPlainString());
    kpis.put("remaining_ht", s.remaining().toPlainString());
    kpis.put("monthly_burn_rate", s.burnRate().toPlainString());
    try {
      var result = advisoryProvider.generateSuggestions(Collections.unmodifiableMap(kpis));
      return result != null ? result : List.of();
    } catch (RuntimeException e) {
      log.warn(
          "Advisory provider {} failed for project {}, using rules only: {}",
          advisoryProvider.providerId(),
          projectId,
          e.getMessage());
      return List.of();
    }
  }

  private record Snapshot(
      BigDecimal revised,
      BigDecimal engaged,
      BigDecimal realized,
      BigDecimal remaining,
      BigDecimal engagedPct,
      BigDecimal realizedPct,
      BigDecimal marginPct,
      BigDecimal burnRate,
      BigDecimal plannedMonthly) {}
}
