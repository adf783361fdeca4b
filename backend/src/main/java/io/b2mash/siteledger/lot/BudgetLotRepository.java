package io.b2mash.siteledger.lot;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BudgetLotRepository extends JpaRepository<BudgetLot, UUID> {

  @Query("SELECT l FROM BudgetLot l WHERE l.id = :id AND l.deletedAt IS NULL")
  Optional<BudgetLot> findLiveById(@Param("id") UUID id);

  @Query(
      """
      SELECT l FROM BudgetLot l
      WHERE l.budgetId = :budgetId AND l.deletedAt IS NULL
      ORDER BY l.position, l.code
      """)
  List<BudgetLot> findLiveByBudgetId(@Param("budgetId") UUID budgetId);

  @Query(
      """
      SELECT l FROM BudgetLot l
      WHERE l.quoteId = :quoteId AND l.deletedAt IS NULL
      ORDER BY l.position, l.code
      """)
  List<BudgetLot> findLiveByQuoteId(@Param("quoteId") UUID quoteId);

  @Query(
      """
      SELECT COUNT(l) > 0 FROM BudgetLot l
      WHERE (l.budgetId = :ownerId OR l.quoteId = :ownerId)
        AND l.code = :code
        AND l.deletedAt IS NULL
      """)
  boolean existsLiveByOwnerAndCode(@Param("ownerId") UUID ownerId, @Param("code") String code);

  @Query(
      "SELECT COUNT(l) > 0 FROM BudgetLot l WHERE l.parentLotId = :lotId AND l.deletedAt IS NULL")
  boolean hasLiveChildren(@Param("lotId") UUID lotId);

  @Query(
      """
      SELECT COALESCE(SUM(l.plannedTotalHt), 0) FROM BudgetLot l
      WHERE l.budgetId = :budgetId AND l.deletedAt IS NULL
      """)
  BigDecimal sumPlannedTotalByBudgetId(@Param("budgetId") UUID budgetId);
}
