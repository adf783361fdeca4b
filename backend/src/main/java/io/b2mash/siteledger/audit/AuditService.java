package io.b2mash.siteledger.audit;

/**
 * Append-only journal sink. One line per mutating operation; the financial core never reads it
 * back.
 */
public interface AuditService {

  /**
   * Records one journal line. Implementations must not propagate failures: a journal write that
   * fails is logged and dropped, and the calling business operation proceeds.
   *
   * @param record the event to persist
   */
  void log(AuditEventRecord record);
}
