package io.b2mash.siteledger.progress;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Progress statement lifecycle, strictly linear:
 * DRAFT -> SUBMITTED_FOR_REVIEW -> ISSUED -> CLIENT_VALIDATED -> INVOICED.
 */
public enum ProgressStatementStatus {
  DRAFT,
  SUBMITTED_FOR_REVIEW,
  ISSUED,
  CLIENT_VALIDATED,
  INVOICED;

  /**
   * Statements past internal validation. The latest of these seeds the carry-forward of the next
   * statement.
   */
  public static final Set<ProgressStatementStatus> VALIDATED_FOR_BILLING =
      Collections.unmodifiableSet(EnumSet.of(ISSUED, CLIENT_VALIDATED, INVOICED));

  private static final Map<ProgressStatementStatus, Set<ProgressStatementStatus>> TRANSITIONS =
      new EnumMap<>(ProgressStatementStatus.class);

  static {
    TRANSITIONS.put(DRAFT, EnumSet.of(SUBMITTED_FOR_REVIEW));
    TRANSITIONS.put(SUBMITTED_FOR_REVIEW, EnumSet.of(ISSUED));
    TRANSITIONS.put(ISSUED, EnumSet.of(CLIENT_VALIDATED));
    TRANSITIONS.put(CLIENT_VALIDATED, EnumSet.of(INVOICED));
    TRANSITIONS.put(INVOICED, EnumSet.noneOf(ProgressStatementStatus.class));
  }

  public boolean canTransitionTo(ProgressStatementStatus target) {
    return TRANSITIONS.get(this).contains(target);
  }
}
