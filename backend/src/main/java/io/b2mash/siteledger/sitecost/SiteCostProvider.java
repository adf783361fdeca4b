package io.b2mash.siteledger.sitecost;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Port for costs booked outside purchasing: timesheet labor and the internal equipment fleet.
 * Supplier-invoiced equipment is excluded here since it is already realized through purchase
 * orders.
 */
public interface SiteCostProvider {

  BigDecimal laborCost(UUID projectId);

  BigDecimal internalEquipmentCost(UUID projectId);
}
