package io.b2mash.siteledger.advisory;

/** Declaration order is display order: critical first. */
public enum SuggestionSeverity {
  CRITICAL,
  WARNING,
  INFO
}
