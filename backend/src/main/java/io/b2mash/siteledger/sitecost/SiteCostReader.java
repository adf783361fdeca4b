package io.b2mash.siteledger.sitecost;

import io.b2mash.siteledger.money.MonetaryCalculator;
import java.math.BigDecimal;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads site costs through {@link SiteCostProvider}, counting an unavailable figure as zero so a
 * failing cost source never blocks alerting or reporting.
 */
@Component
public class SiteCostReader {

  private static final Logger log = LoggerFactory.getLogger(SiteCostReader.class);

  private final SiteCostProvider provider;

  public SiteCostReader(SiteCostProvider provider) {
    this.provider = provider;
  }

  public BigDecimal laborCost(UUID projectId) {
    return read("labor", projectId, provider::laborCost);
  }

  public BigDecimal internalEquipmentCost(UUID projectId) {
    return read("internal equipment", projectId, provider::internalEquipmentCost);
  }

  private BigDecimal read(String category, UUID projectId, Function<UUID, BigDecimal> source) {
    try {
      return MonetaryCalculator.nz(source.apply(projectId));
    } catch (RuntimeException e) {
      log.warn(
          "Failed to read {} cost for project {}, counting it as zero: {}",
          category,
          projectId,
          e.getMessage());
      return BigDecimal.ZERO;
    }
  }
}
