package io.b2mash.siteledger.allocation;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskLotAllocationRepository extends JpaRepository<TaskLotAllocation, UUID> {

  @Query(
      """
      SELECT a FROM TaskLotAllocation a
      WHERE a.projectId = :projectId
      ORDER BY a.createdAt
      """)
  List<TaskLotAllocation> findByProjectId(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT a FROM TaskLotAllocation a
      WHERE a.taskId = :taskId
      ORDER BY a.createdAt
      """)
  List<TaskLotAllocation> findByTaskId(@Param("taskId") UUID taskId);

  @Query(
      """
      SELECT COUNT(a) > 0 FROM TaskLotAllocation a
      WHERE a.taskId = :taskId AND a.lotId = :lotId
      """)
  boolean existsByTaskIdAndLotId(@Param("taskId") UUID taskId, @Param("lotId") UUID lotId);
}
