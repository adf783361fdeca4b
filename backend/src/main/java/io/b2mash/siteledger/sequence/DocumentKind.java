package io.b2mash.siteledger.sequence;

/** Numbered document families, each with its own counter and display format. */
public enum DocumentKind {
  /** {@code FAC-2025-0001}, scoped per calendar year. */
  INVOICE("FAC-%d-%04d"),
  /** {@code SIT-2025-01}, scoped per project and year. */
  PROGRESS_STATEMENT("SIT-%d-%02d"),
  /** {@code AVN-2025-01}, scoped per budget and year. */
  AMENDMENT("AVN-%d-%02d");

  private final String pattern;

  DocumentKind(String pattern) {
    this.pattern = pattern;
  }

  public String format(int year, int value) {
    return String.format(pattern, year, value);
  }
}
