package io.b2mash.siteledger.allocation;

import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when no planning system is connected: every task reads as unknown with 0% progress. */
@Component
@ConditionalOnProperty(
    name = "siteledger.tasks.progress-source",
    havingValue = "none",
    matchIfMissing = true)
public class UnavailableTaskProgressProvider implements TaskProgressProvider {

  private static final Logger log = LoggerFactory.getLogger(UnavailableTaskProgressProvider.class);

  @Override
  public Map<UUID, TaskProgress> progressByTask(UUID projectId) {
    log.debug("No task progress source configured for project {}", projectId);
    return Map.of();
  }
}
