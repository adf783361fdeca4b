package io.b2mash.siteledger.purchase;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Every query excludes tombstoned orders. The sum queries are the aggregation primitive for engaged
 * and realized amounts: they add the reconciled amount when present and the nominal total
 * otherwise.
 */
public interface PurchaseOrderRepository extends JpaRepository<PurchaseOrder, UUID> {

  @Query("SELECT p FROM PurchaseOrder p WHERE p.id = :id AND p.deletedAt IS NULL")
  Optional<PurchaseOrder> findLiveById(@Param("id") UUID id);

  @Query(
      """
      SELECT p FROM PurchaseOrder p
      WHERE p.projectId = :projectId AND p.deletedAt IS NULL
      ORDER BY p.createdAt DESC
      """)
  List<PurchaseOrder> findLiveByProjectId(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT p FROM PurchaseOrder p
      WHERE p.projectId = :projectId AND p.status = :status AND p.deletedAt IS NULL
      ORDER BY p.createdAt DESC
      """)
  List<PurchaseOrder> findLiveByProjectIdAndStatus(
      @Param("projectId") UUID projectId, @Param("status") PurchaseOrderStatus status);

  @Query(
      """
      SELECT p FROM PurchaseOrder p
      WHERE p.status = :status AND p.deletedAt IS NULL
      ORDER BY p.createdAt
      """)
  List<PurchaseOrder> findLiveByStatus(@Param("status") PurchaseOrderStatus status);

  @Query(
      """
      SELECT COALESCE(SUM(COALESCE(p.realAmountHt, p.totalHt)), 0) FROM PurchaseOrder p
      WHERE p.projectId = :projectId
        AND p.status IN :statuses
        AND p.deletedAt IS NULL
      """)
  BigDecimal sumTotalsByProjectAndStatuses(
      @Param("projectId") UUID projectId,
      @Param("statuses") Collection<PurchaseOrderStatus> statuses);

  @Query(
      """
      SELECT COALESCE(SUM(COALESCE(p.realAmountHt, p.totalHt)), 0) FROM PurchaseOrder p
      WHERE p.lotId = :lotId
        AND p.status IN :statuses
        AND p.deletedAt IS NULL
      """)
  BigDecimal sumTotalsByLotAndStatuses(
      @Param("lotId") UUID lotId, @Param("statuses") Collection<PurchaseOrderStatus> statuses);

  @Query(
      """
      SELECT p.lotId AS lotId, COALESCE(SUM(COALESCE(p.realAmountHt, p.totalHt)), 0) AS total
      FROM PurchaseOrder p
      WHERE p.lotId IN :lotIds
        AND p.status IN :statuses
        AND p.deletedAt IS NULL
      GROUP BY p.lotId
      """)
  List<LotTotal> sumTotalsGroupedByLot(
      @Param("lotIds") Collection<UUID> lotIds,
      @Param("statuses") Collection<PurchaseOrderStatus> statuses);

  /** Projection row of {@link #sumTotalsGroupedByLot}. */
  interface LotTotal {
    UUID getLotId();

    BigDecimal getTotal();
  }
}
