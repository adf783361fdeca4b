package io.b2mash.siteledger.sequence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reserves sequential document numbers.
 *
 * <p>The reservation is a single {@code INSERT ... ON CONFLICT DO UPDATE ... RETURNING} statement:
 * concurrent callers serialize on the counter row lock and never receive the same value. Numbers
 * are gap-free within a committed history because a rollback reverts the counter too.
 */
@Service
public class DocumentNumberService {

  /** Scope used for counters that are global per year (client invoices). */
  static final UUID GLOBAL_SCOPE = new UUID(0L, 0L);

  @PersistenceContext private EntityManager entityManager;

  private final Clock clock;

  public DocumentNumberService(Clock clock) {
    this.clock = clock;
  }

  /**
   * Atomically reserves the next value for {@code (kind, scopeId, year)}. The first call for a new
   * key returns 1.
   */
  @Transactional
  public int reserveNext(DocumentKind kind, UUID scopeId, int year) {
    var result =
        entityManager
            .createNativeQuery(
                "INSERT INTO document_counters (id, kind, scope_id, year, next_value)"
                    + " VALUES (gen_random_uuid(), :kind, :scopeId, :year, 2)"
                    + " ON CONFLICT (kind, scope_id, year)"
                    + " DO UPDATE SET next_value = document_counters.next_value + 1"
                    + " RETURNING next_value - 1")
            .setParameter("kind", kind.name())
            .setParameter("scopeId", scopeId)
            .setParameter("year", year)
            .getSingleResult();
    return ((Number) result).intValue();
  }

  @Transactional
  public String nextInvoiceNumber() {
    int year = currentYear();
    return DocumentKind.INVOICE.format(year, reserveNext(DocumentKind.INVOICE, GLOBAL_SCOPE, year));
  }

  @Transactional
  public String nextStatementNumber(UUID projectId) {
    int year = currentYear();
    return DocumentKind.PROGRESS_STATEMENT.format(
        year, reserveNext(DocumentKind.PROGRESS_STATEMENT, projectId, year));
  }

  @Transactional
  public String nextAmendmentNumber(UUID budgetId) {
    int year = currentYear();
    return DocumentKind.AMENDMENT.format(
        year, reserveNext(DocumentKind.AMENDMENT, budgetId, year));
  }

  private int currentYear() {
    return LocalDate.now(clock).getYear();
  }
}
