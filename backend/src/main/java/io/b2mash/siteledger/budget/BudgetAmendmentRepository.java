package io.b2mash.siteledger.budget;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BudgetAmendmentRepository extends JpaRepository<BudgetAmendment, UUID> {

  @Query("SELECT a FROM BudgetAmendment a WHERE a.id = :id AND a.deletedAt IS NULL")
  Optional<BudgetAmendment> findLiveById(@Param("id") UUID id);

  @Query(
      """
      SELECT a FROM BudgetAmendment a
      WHERE a.budgetId = :budgetId AND a.deletedAt IS NULL
      ORDER BY a.createdAt
      """)
  List<BudgetAmendment> findLiveByBudgetId(@Param("budgetId") UUID budgetId);

  /** Source of truth for {@link Budget#getAmendmentsAmountHt()}. */
  @Query(
      """
      SELECT COALESCE(SUM(a.amountHt), 0) FROM BudgetAmendment a
      WHERE a.budgetId = :budgetId
        AND a.status = io.b2mash.siteledger.budget.AmendmentStatus.VALIDATED
        AND a.deletedAt IS NULL
      """)
  BigDecimal sumValidatedAmounts(@Param("budgetId") UUID budgetId);
}
