package io.b2mash.siteledger.project;

import java.util.Optional;
import java.util.UUID;

/**
 * Port for read-only project lookups. Projects live in another bounded context; the ledger only
 * needs a name for reports and the status to decide whether a P&L is final.
 */
public interface ProjectInfoProvider {

  Optional<ProjectInfo> find(UUID projectId);
}
