package io.b2mash.siteledger.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed {@link AuditService}.
 *
 * <p>Each line is written in its own {@code REQUIRES_NEW} transaction, so a failed insert neither
 * marks the caller's transaction rollback-only nor surfaces as an exception.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final TransactionTemplate transactionTemplate;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, PlatformTransactionManager transactionManager) {
    this.auditEventRepository = auditEventRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public void log(AuditEventRecord record) {
    try {
      transactionTemplate.executeWithoutResult(
          status -> auditEventRepository.save(new AuditEvent(record)));
      log.debug(
          "Recorded audit event: type={}, entity={}/{}, actor={}",
          record.eventType(),
          record.entityType(),
          record.entityId(),
          record.actorId());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record audit event type={} entity={}/{}: {}",
          record.eventType(),
          record.entityType(),
          record.entityId(),
          e.getMessage());
    }
  }
}
