package io.b2mash.siteledger.advisory;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "siteledger.advisory.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class NoOpAdvisoryProvider implements AdvisoryProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpAdvisoryProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public List<Suggestion> generateSuggestions(Map<String, String> kpis) {
    log.debug("NoOp advisory: would send {} KPIs", kpis.size());
    return List.of();
  }
}
