package io.b2mash.siteledger.project;

import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class UnknownProjectInfoProvider implements ProjectInfoProvider {

  private static final Logger log = LoggerFactory.getLogger(UnknownProjectInfoProvider.class);

  @Override
  public Optional<ProjectInfo> find(UUID projectId) {
    log.debug("No project directory configured, project {} is unknown", projectId);
    return Optional.empty();
  }
}
