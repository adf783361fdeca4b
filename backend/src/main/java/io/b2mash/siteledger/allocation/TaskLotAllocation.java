package io.b2mash.siteledger.allocation;

import io.b2mash.siteledger.exception.InputValidation;
import io.b2mash.siteledger.money.MonetaryCalculator;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Share of a site lot's planned amount assigned to a planning task. The task lives in the planning
 * system and is referenced by id only.
 */
@Entity
@Table(name = "task_lot_allocations")
public class TaskLotAllocation {

  static final BigDecimal FULL_PCT = new BigDecimal("100");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "task_id", nullable = false, updatable = false)
  private UUID taskId;

  @Column(name = "lot_id", nullable = false, updatable = false)
  private UUID lotId;

  @Column(name = "allocation_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal allocationPct;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TaskLotAllocation() {}

  /** A null percentage allocates the whole lot. */
  public TaskLotAllocation(
      UUID projectId, UUID taskId, UUID lotId, BigDecimal allocationPct, UUID createdBy) {
    this.projectId = InputValidation.requirePresent("projectId", projectId);
    this.taskId = InputValidation.requirePresent("taskId", taskId);
    this.lotId = InputValidation.requirePresent("lotId", lotId);
    this.allocationPct =
        MonetaryCalculator.roundPct(
            InputValidation.requireInRange(
                "allocationPct",
                allocationPct != null ? allocationPct : FULL_PCT,
                BigDecimal.ZERO,
                FULL_PCT));
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  /** Planned amount of the lot times the allocated share. */
  public BigDecimal allocatedAmount(BigDecimal lotPlannedTotalHt) {
    return MonetaryCalculator.roundAmount(
        MonetaryCalculator.nz(lotPlannedTotalHt).multiply(allocationPct).divide(FULL_PCT));
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public UUID getLotId() {
    return lotId;
  }

  public BigDecimal getAllocationPct() {
    return allocationPct;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
