package io.b2mash.siteledger.advisory;

import java.util.List;
import java.util.Map;

/**
 * Port to an external financial advisor. Implementations must not throw: any failure or timeout
 * yields an empty list and the caller falls back to rule-based suggestions.
 */
public interface AdvisoryProvider {

  /** Provider identifier (e.g., "http", "noop"). */
  String providerId();

  /**
   * @param kpis flat snapshot of the project's indicators, decimal values rendered as plain strings
   */
  List<Suggestion> generateSuggestions(Map<String, String> kpis);
}
