package io.b2mash.siteledger.budget;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BudgetRepository extends JpaRepository<Budget, UUID> {

  @Query("SELECT b FROM Budget b WHERE b.id = :id AND b.deletedAt IS NULL")
  Optional<Budget> findLiveById(@Param("id") UUID id);

  @Query("SELECT b FROM Budget b WHERE b.projectId = :projectId AND b.deletedAt IS NULL")
  Optional<Budget> findLiveByProjectId(@Param("projectId") UUID projectId);

  @Query(
      "SELECT COUNT(b) > 0 FROM Budget b WHERE b.projectId = :projectId AND b.deletedAt IS NULL")
  boolean existsLiveByProjectId(@Param("projectId") UUID projectId);
}
