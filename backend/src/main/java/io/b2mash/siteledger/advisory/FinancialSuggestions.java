package io.b2mash.siteledger.advisory;

import java.util.List;
import java.util.UUID;

/**
 * @param source {@link #SOURCE_RULES} or {@link #SOURCE_ADVISORY}
 */
public record FinancialSuggestions(
    UUID projectId,
    List<Suggestion> suggestions,
    PredictiveIndicators indicators,
    boolean advisoryUsed,
    String source) {

  public static final String SOURCE_RULES = "rules";
  public static final String SOURCE_ADVISORY = "advisory";
}
