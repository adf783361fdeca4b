package io.b2mash.siteledger.allocation;

import java.util.Map;
import java.util.UUID;

/** Source of physical task progress. Implementations are selected by configuration. */
public interface TaskProgressProvider {

  /** Progress of the project's tasks keyed by task id. Tasks it does not know are absent. */
  Map<UUID, TaskProgress> progressByTask(UUID projectId);
}
