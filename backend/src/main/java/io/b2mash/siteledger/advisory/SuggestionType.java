package io.b2mash.siteledger.advisory;

import java.util.Arrays;
import java.util.Optional;

/** Suggestion categories. Merging keeps at most one source per category. */
public enum SuggestionType {
  CREATE_AMENDMENT,
  REDUCE_COSTS,
  OPTIMIZE_LOTS,
  ALERT_BURN_RATE,
  CREATE_PROGRESS_STATEMENT,
  RENEGOTIATE_SUPPLIERS,
  REVIEW_PLANNING;

  /** Lenient lookup for categories coming from an external advisor. */
  public static Optional<SuggestionType> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    var normalized = code.trim().toUpperCase();
    return Arrays.stream(values()).filter(t -> t.name().equals(normalized)).findFirst();
  }
}
