package io.b2mash.siteledger.progress;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProgressStatementRepository extends JpaRepository<ProgressStatement, UUID> {

  @Query("SELECT s FROM ProgressStatement s WHERE s.id = :id AND s.deletedAt IS NULL")
  Optional<ProgressStatement> findLiveById(@Param("id") UUID id);

  @Query(
      """
      SELECT s FROM ProgressStatement s
      WHERE s.projectId = :projectId AND s.deletedAt IS NULL
      ORDER BY s.createdAt DESC
      """)
  List<ProgressStatement> findLiveByProjectId(@Param("projectId") UUID projectId);

  /** Most recent live statement of the project in one of {@code statuses}. */
  Optional<ProgressStatement> findFirstByProjectIdAndStatusInAndDeletedAtIsNullOrderByCreatedAtDesc(
      UUID projectId, Collection<ProgressStatementStatus> statuses);
}
