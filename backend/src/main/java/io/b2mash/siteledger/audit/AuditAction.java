package io.b2mash.siteledger.audit;

/** Journal action verbs. */
public enum AuditAction {
  CREATE,
  UPDATE,
  DELETE,
  VALIDATE,
  REJECT,
  ISSUE,
  INVOICE,
  ACKNOWLEDGE
}
