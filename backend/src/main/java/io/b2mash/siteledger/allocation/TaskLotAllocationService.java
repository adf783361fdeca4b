package io.b2mash.siteledger.allocation;

import io.b2mash.siteledger.allocation.dto.CreateAllocationRequest;
import io.b2mash.siteledger.audit.AuditAction;
import io.b2mash.siteledger.audit.AuditEventBuilder;
import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.ResourceConflictException;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.lot.BudgetLot;
import io.b2mash.siteledger.lot.BudgetLotRepository;
import io.b2mash.siteledger.lot.LotPhase;
import io.b2mash.siteledger.money.MonetaryCalculator;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Links planning tasks to site lots and reports physical progress against the allocated budget.
 */
@Service
public class TaskLotAllocationService {

  private static final Logger log = LoggerFactory.getLogger(TaskLotAllocationService.class);

  static final String UNKNOWN_TASK_TITLE = "Unknown task";
  static final String UNKNOWN_TASK_STATUS = "unknown";

  private final TaskLotAllocationRepository allocationRepository;
  private final BudgetLotRepository lotRepository;
  private final BudgetRepository budgetRepository;
  private final TaskProgressProvider taskProgressProvider;
  private final AuditService auditService;

  public TaskLotAllocationService(
      TaskLotAllocationRepository allocationRepository,
      BudgetLotRepository lotRepository,
      BudgetRepository budgetRepository,
      TaskProgressProvider taskProgressProvider,
      AuditService auditService) {
    this.allocationRepository = allocationRepository;
    this.lotRepository = lotRepository;
    this.budgetRepository = budgetRepository;
    this.taskProgressProvider = taskProgressProvider;
    this.auditService = auditService;
  }

  /**
   * Allocates a share of a site lot to a task. The project is the one owning the lot's budget.
   *
   * @throws ResourceNotFoundException if the lot or its budget does not exist
   * @throws InvalidStateException if the lot is a quote lot or the percentage is outside 0..100
   * @throws ResourceConflictException if the task already has an allocation on this lot
   */
  @Transactional
  public TaskLotAllocation create(CreateAllocationRequest request, UUID actorId) {
    var lot =
        lotRepository
            .findLiveById(request.lotId())
            .orElseThrow(() -> new ResourceNotFoundException("BudgetLot", request.lotId()));
    if (lot.getPhase() != LotPhase.SITE) {
      throw InvalidStateException.forField(
          "lotId", "Lot " + lot.getCode() + " is a quote lot, only site lots take allocations");
    }
    var budget =
        budgetRepository
            .findLiveById(lot.getBudgetId())
            .orElseThrow(() -> new ResourceNotFoundException("Budget", lot.getBudgetId()));
    if (allocationRepository.existsByTaskIdAndLotId(request.taskId(), lot.getId())) {
      throw ResourceConflictException.duplicate(
          "Duplicate allocation", "taskId/lotId", request.taskId() + "/" + lot.getId());
    }

    var allocation =
        allocationRepository.save(
            new TaskLotAllocation(
                budget.getProjectId(),
                request.taskId(),
                lot.getId(),
                request.allocationPct(),
                actorId));
    log.info(
        "Allocated {}% of lot {} to task {}",
        allocation.getAllocationPct(),
        lot.getCode(),
        allocation.getTaskId());
    journal(
        allocation,
        AuditAction.CREATE,
        "Task "
            + allocation.getTaskId()
            + " allocated to lot "
            + lot.getCode()
            + " ("
            + allocation.getAllocationPct()
            + "%)",
        actorId);
    return allocation;
  }

  @Transactional
  public void delete(UUID allocationId, UUID actorId) {
    var allocation =
        allocationRepository
            .findById(allocationId)
            .orElseThrow(() -> new ResourceNotFoundException("TaskLotAllocation", allocationId));
    allocationRepository.delete(allocation);
    log.info("Deleted allocation {} of task {}", allocationId, allocation.getTaskId());
    journal(
        allocation,
        AuditAction.DELETE,
        "Allocation of task " + allocation.getTaskId() + " removed",
        actorId);
  }

  @Transactional(readOnly = true)
  public List<TaskLotAllocation> listByProject(UUID projectId) {
    return allocationRepository.findByProjectId(projectId);
  }

  @Transactional(readOnly = true)
  public List<TaskLotAllocation> listByTask(UUID taskId) {
    return allocationRepository.findByTaskId(taskId);
  }

  /**
   * Physical versus financial progress for every allocation of the project. Allocations whose lot
   * has since been deleted are left out. Tasks the progress source does not know read as unknown
   * with 0% progress.
   */
  @Transactional(readOnly = true)
  public List<AllocationProgress> financialProgress(UUID projectId) {
    var allocations = allocationRepository.findByProjectId(projectId);
    if (allocations.isEmpty()) {
      return List.of();
    }
    var lots =
        lotRepository
            .findAllById(allocations.stream().map(TaskLotAllocation::getLotId).distinct().toList())
            .stream()
            .filter(lot -> !lot.isDeleted())
            .collect(Collectors.toMap(BudgetLot::getId, Function.identity()));
    var progress = taskProgressProvider.progressByTask(projectId);

    var rows = new ArrayList<AllocationProgress>(allocations.size());
    for (var allocation : allocations) {
      var lot = lots.get(allocation.getLotId());
      if (lot == null) {
        log.debug("Skipping allocation {}: lot no longer exists", allocation.getId());
        continue;
      }
      rows.add(toProgress(allocation, lot, progress.get(allocation.getTaskId())));
    }
    return rows;
  }

  private static AllocationProgress toProgress(
      TaskLotAllocation allocation, BudgetLot lot, TaskProgress task) {
    var planned = MonetaryCalculator.nz(lot.getPlannedTotalHt());
    var allocated = allocation.allocatedAmount(planned);
    var progressPct = task != null ? MonetaryCalculator.nz(task.progressPct()) : BigDecimal.ZERO;
    var earned =
        MonetaryCalculator.roundAmount(
            allocated.multiply(progressPct).divide(TaskLotAllocation.FULL_PCT));
    return new AllocationProgress(
        allocation.getId(),
        allocation.getTaskId(),
        task != null ? task.title() : UNKNOWN_TASK_TITLE,
        task != null ? task.status() : UNKNOWN_TASK_STATUS,
        progressPct,
        lot.getId(),
        lot.getCode(),
        lot.getLabel(),
        planned,
        allocation.getAllocationPct(),
        allocated,
        earned);
  }

  private void journal(
      TaskLotAllocation allocation, AuditAction action, String detail, UUID actorId) {
    auditService.log(
        AuditEventBuilder.builder()
            .entityType("task_lot_allocation")
            .entityId(allocation.getId())
            .projectId(allocation.getProjectId())
            .action(action)
            .detail(detail)
            .actorId(actorId)
            .details(
                Map.of(
                    "taskId", allocation.getTaskId().toString(),
                    "lotId", allocation.getLotId().toString(),
                    "allocationPct", allocation.getAllocationPct().toPlainString()))
            .build());
  }
}
