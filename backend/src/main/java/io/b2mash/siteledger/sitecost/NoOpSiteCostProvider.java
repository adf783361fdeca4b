package io.b2mash.siteledger.sitecost;

import java.math.BigDecimal;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class NoOpSiteCostProvider implements SiteCostProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpSiteCostProvider.class);

  @Override
  public BigDecimal laborCost(UUID projectId) {
    log.debug("NoOp site costs: labor cost for project {} is zero", projectId);
    return BigDecimal.ZERO;
  }

  @Override
  public BigDecimal internalEquipmentCost(UUID projectId) {
    log.debug("NoOp site costs: equipment cost for project {} is zero", projectId);
    return BigDecimal.ZERO;
  }
}
