package io.b2mash.siteledger.purchase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Purchase order lifecycle.
 *
 * <pre>
 * REQUESTED -> APPROVED | REJECTED
 * APPROVED  -> ORDERED  | REJECTED
 * ORDERED   -> RECEIVED
 * RECEIVED  -> INVOICED
 * </pre>
 *
 * REJECTED and INVOICED are terminal.
 */
public enum PurchaseOrderStatus {
  REQUESTED,
  APPROVED,
  REJECTED,
  ORDERED,
  RECEIVED,
  INVOICED;

  /** Statuses whose amounts count as committed spend. */
  public static final Set<PurchaseOrderStatus> ENGAGED =
      Collections.unmodifiableSet(EnumSet.of(APPROVED, ORDERED, RECEIVED, INVOICED));

  /** Statuses whose amounts count as actually spent. */
  public static final Set<PurchaseOrderStatus> REALIZED =
      Collections.unmodifiableSet(EnumSet.of(INVOICED));

  private static final Map<PurchaseOrderStatus, Set<PurchaseOrderStatus>> TRANSITIONS =
      new EnumMap<>(PurchaseOrderStatus.class);

  static {
    TRANSITIONS.put(REQUESTED, EnumSet.of(APPROVED, REJECTED));
    TRANSITIONS.put(APPROVED, EnumSet.of(ORDERED, REJECTED));
    TRANSITIONS.put(ORDERED, EnumSet.of(RECEIVED));
    TRANSITIONS.put(RECEIVED, EnumSet.of(INVOICED));
    TRANSITIONS.put(REJECTED, EnumSet.noneOf(PurchaseOrderStatus.class));
    TRANSITIONS.put(INVOICED, EnumSet.noneOf(PurchaseOrderStatus.class));
  }

  public boolean canTransitionTo(PurchaseOrderStatus target) {
    return TRANSITIONS.get(this).contains(target);
  }

  public Set<PurchaseOrderStatus> allowedTargets() {
    return Collections.unmodifiableSet(TRANSITIONS.get(this));
  }

  public boolean isTerminal() {
    return TRANSITIONS.get(this).isEmpty();
  }
}
