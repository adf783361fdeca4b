package io.b2mash.siteledger.advisory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;

/**
 * Combines advisor and rule suggestions. Advisor suggestions are kept as given; a rule suggestion
 * is dropped when the advisor already covers its category. The result is stably sorted by severity
 * and capped.
 */
public final class SuggestionMerger {

  private static final Comparator<Suggestion> BY_SEVERITY =
      Comparator.comparing(Suggestion::severity);

  private SuggestionMerger() {}

  public static List<Suggestion> merge(
      List<Suggestion> external, List<Suggestion> rules, int maxSuggestions) {
    var covered = EnumSet.noneOf(SuggestionType.class);
    external.forEach(s -> covered.add(s.type()));

    var merged = new ArrayList<Suggestion>(external);
    rules.stream().filter(s -> !covered.contains(s.type())).forEach(merged::add);
    return sortAndCap(merged, maxSuggestions);
  }

  public static List<Suggestion> sortAndCap(List<Suggestion> suggestions, int maxSuggestions) {
    // List.sort is stable, so equal severities keep insertion order
    var sorted = new ArrayList<>(suggestions);
    sorted.sort(BY_SEVERITY);
    return List.copyOf(sorted.subList(0, Math.min(maxSuggestions, sorted.size())));
  }
}
