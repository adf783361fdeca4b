package io.b2mash.siteledger.invoice;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ClientInvoiceRepository extends JpaRepository<ClientInvoice, UUID> {

  @Query("SELECT i FROM ClientInvoice i WHERE i.id = :id AND i.deletedAt IS NULL")
  Optional<ClientInvoice> findLiveById(@Param("id") UUID id);

  @Query(
      """
      SELECT i FROM ClientInvoice i
      WHERE i.projectId = :projectId AND i.deletedAt IS NULL
      ORDER BY i.createdAt DESC
      """)
  List<ClientInvoice> findLiveByProjectId(@Param("projectId") UUID projectId);

  /** Cancelled invoices release their statement so it can be invoiced again. */
  @Query(
      """
      SELECT COUNT(i) > 0 FROM ClientInvoice i
      WHERE i.statementId = :statementId
        AND i.status <> io.b2mash.siteledger.invoice.ClientInvoiceStatus.CANCELLED
        AND i.deletedAt IS NULL
      """)
  boolean existsActiveByStatementId(@Param("statementId") UUID statementId);

  @Query(
      """
      SELECT COALESCE(SUM(i.amountHt), 0) FROM ClientInvoice i
      WHERE i.projectId = :projectId
        AND i.status IN :statuses
        AND i.deletedAt IS NULL
      """)
  BigDecimal sumAmountByProjectAndStatuses(
      @Param("projectId") UUID projectId,
      @Param("statuses") Collection<ClientInvoiceStatus> statuses);
}
