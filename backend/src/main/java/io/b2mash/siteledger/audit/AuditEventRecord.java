package io.b2mash.siteledger.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType free-form event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being journaled (e.g. "purchase_order", "budget")
 * @param entityId ID of the affected entity (not a FK, the entity may be tombstoned later)
 * @param projectId owning project, when the entity has one
 * @param action the journal verb
 * @param detail human-readable one-line description
 * @param actorId acting user; null for system-initiated events
 * @param details key field changes; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    AuditAction action,
    String detail,
    UUID actorId,
    Map<String, Object> details) {}
