package io.b2mash.siteledger.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Builder for {@link AuditEventRecord}. {@code eventType} defaults to {@code entityType + "." +
 * action} when not set explicitly.
 *
 * <pre>{@code
 * auditService.log(
 *     AuditEventBuilder.builder()
 *         .entityType("purchase_order")
 *         .entityId(order.getId())
 *         .projectId(order.getProjectId())
 *         .action(AuditAction.VALIDATE)
 *         .detail("Approved")
 *         .actorId(actor)
 *         .build());
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID projectId;
  private AuditAction action;
  private String detail;
  private UUID actorId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder projectId(UUID projectId) {
    this.projectId = projectId;
    return this;
  }

  public AuditEventBuilder action(AuditAction action) {
    this.action = action;
    return this;
  }

  public AuditEventBuilder detail(String detail) {
    this.detail = detail;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    String resolvedEventType = eventType;
    if (resolvedEventType == null && action != null) {
      resolvedEventType = entityType + "." + action.name().toLowerCase();
    }
    return new AuditEventRecord(
        resolvedEventType, entityType, entityId, projectId, action, detail, actorId, details);
  }
}
