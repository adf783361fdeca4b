package io.b2mash.siteledger.budget;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/** Amendment lifecycle: {@code DRAFT -> VALIDATED}. VALIDATED is terminal. */
public enum AmendmentStatus {
  DRAFT,
  VALIDATED;

  private static final Map<AmendmentStatus, Set<AmendmentStatus>> TRANSITIONS =
      new EnumMap<>(AmendmentStatus.class);

  static {
    TRANSITIONS.put(DRAFT, EnumSet.of(VALIDATED));
    TRANSITIONS.put(VALIDATED, EnumSet.noneOf(AmendmentStatus.class));
  }

  public boolean canTransitionTo(AmendmentStatus target) {
    return TRANSITIONS.get(this).contains(target);
  }
}
