package io.b2mash.siteledger.invoice;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Client invoice lifecycle.
 *
 * <ul>
 *   <li>DRAFT → ISSUED | CANCELLED
 *   <li>ISSUED → SENT | CANCELLED
 *   <li>SENT → PAID
 *   <li>PAID and CANCELLED are terminal
 * </ul>
 */
public enum ClientInvoiceStatus {
  DRAFT,
  ISSUED,
  SENT,
  PAID,
  CANCELLED;

  /** Statuses that count as revenue. */
  public static final Set<ClientInvoiceStatus> BILLED =
      Collections.unmodifiableSet(EnumSet.of(ISSUED, SENT, PAID));

  private static final Map<ClientInvoiceStatus, Set<ClientInvoiceStatus>> TRANSITIONS =
      new EnumMap<>(ClientInvoiceStatus.class);

  static {
    TRANSITIONS.put(DRAFT, EnumSet.of(ISSUED, CANCELLED));
    TRANSITIONS.put(ISSUED, EnumSet.of(SENT, CANCELLED));
    TRANSITIONS.put(SENT, EnumSet.of(PAID));
    TRANSITIONS.put(PAID, EnumSet.noneOf(ClientInvoiceStatus.class));
    TRANSITIONS.put(CANCELLED, EnumSet.noneOf(ClientInvoiceStatus.class));
  }

  public boolean canTransitionTo(ClientInvoiceStatus target) {
    return TRANSITIONS.get(this).contains(target);
  }
}
