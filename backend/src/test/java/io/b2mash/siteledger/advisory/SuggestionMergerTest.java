package io.b2mash.siteledger.advisory;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class SuggestionMergerTest {

  private static Suggestion suggestion(SuggestionType type, SuggestionSeverity severity) {
    return new Suggestion(type, severity, type.name(), "", BigDecimal.ZERO);
  }

  @Test
  void merge_dropsRuleCategoriesCoveredByAdvisor() {
    var external =
        List.of(
            suggestion(SuggestionType.OPTIMIZE_LOTS, SuggestionSeverity.INFO),
            suggestion(SuggestionType.RENEGOTIATE_SUPPLIERS, SuggestionSeverity.WARNING));
    var rules =
        List.of(
            suggestion(SuggestionType.CREATE_AMENDMENT, SuggestionSeverity.CRITICAL),
            suggestion(SuggestionType.OPTIMIZE_LOTS, SuggestionSeverity.WARNING),
            suggestion(SuggestionType.OPTIMIZE_LOTS, SuggestionSeverity.WARNING));

    var merged = SuggestionMerger.merge(external, rules, 5);

    assertThat(merged)
        .extracting(Suggestion::type)
        .containsExactly(
            SuggestionType.CREATE_AMENDMENT,
            SuggestionType.RENEGOTIATE_SUPPLIERS,
            SuggestionType.OPTIMIZE_LOTS);
    assertThat(merged.get(2).severity()).isEqualTo(SuggestionSeverity.INFO);
  }

  @Test
  void merge_capsAfterSorting() {
    var external =
        List.of(
            suggestion(SuggestionType.REVIEW_PLANNING, SuggestionSeverity.INFO),
            suggestion(SuggestionType.RENEGOTIATE_SUPPLIERS, SuggestionSeverity.INFO));
    var rules =
        List.of(
            suggestion(SuggestionType.CREATE_AMENDMENT, SuggestionSeverity.CRITICAL),
            suggestion(SuggestionType.REDUCE_COSTS, SuggestionSeverity.WARNING));

    var merged = SuggestionMerger.merge(external, rules, 3);

    assertThat(merged)
        .extracting(Suggestion::type)
        .containsExactly(
            SuggestionType.CREATE_AMENDMENT,
            SuggestionType.REDUCE_COSTS,
            SuggestionType.REVIEW_PLANNING);
  }

  @Test
  void sortAndCap_keepsInsertionOrderWithinSeverity() {
    var list =
        List.of(
            suggestion(SuggestionType.CREATE_PROGRESS_STATEMENT, SuggestionSeverity.INFO),
            suggestion(SuggestionType.REDUCE_COSTS, SuggestionSeverity.WARNING),
            suggestion(SuggestionType.ALERT_BURN_RATE, SuggestionSeverity.WARNING));

    assertThat(SuggestionMerger.sortAndCap(list, 10))
        .extracting(Suggestion::type)
        .containsExactly(
            SuggestionType.REDUCE_COSTS,
            SuggestionType.ALERT_BURN_RATE,
            SuggestionType.CREATE_PROGRESS_STATEMENT);
  }

  @Test
  void fromCode_isLenient() {
    assertThat(SuggestionType.fromCode(" optimize_lots ")).contains(SuggestionType.OPTIMIZE_LOTS);
    assertThat(SuggestionType.fromCode("hire_more_people")).isEmpty();
    assertThat(SuggestionType.fromCode(null)).isEmpty();
  }
}
