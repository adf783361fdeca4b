package io.b2mash.siteledger.alert;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BudgetAlertRepository extends JpaRepository<BudgetAlert, UUID> {

  @Query(
      """
      SELECT a FROM BudgetAlert a
      WHERE a.projectId = :projectId
      ORDER BY a.createdAt DESC
      """)
  List<BudgetAlert> findByProjectId(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT a FROM BudgetAlert a
      WHERE a.projectId = :projectId AND a.acknowledged = false
      ORDER BY a.createdAt DESC
      """)
  List<BudgetAlert> findUnacknowledgedByProjectId(@Param("projectId") UUID projectId);

  @Query(
      "SELECT COUNT(a) FROM BudgetAlert a WHERE a.projectId = :projectId AND a.acknowledged = false")
  long countUnacknowledgedByProjectId(@Param("projectId") UUID projectId);
}
