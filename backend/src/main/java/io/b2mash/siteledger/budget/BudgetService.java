package io.b2mash.siteledger.budget;

import io.b2mash.siteledger.audit.AuditAction;
import io.b2mash.siteledger.audit.AuditEventBuilder;
import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.budget.dto.CreateBudgetRequest;
import io.b2mash.siteledger.budget.dto.UpdateBudgetRequest;
import io.b2mash.siteledger.exception.ResourceConflictException;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.purchase.PurchaseAggregationService;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BudgetService {

  private static final Logger log = LoggerFactory.getLogger(BudgetService.class);

  private final BudgetRepository budgetRepository;
  private final PurchaseAggregationService purchaseAggregationService;
  private final AuditService auditService;

  public BudgetService(
      BudgetRepository budgetRepository,
      PurchaseAggregationService purchaseAggregationService,
      AuditService auditService) {
    this.budgetRepository = budgetRepository;
    this.purchaseAggregationService = purchaseAggregationService;
    this.auditService = auditService;
  }

  /**
   * Creates the budget of a project.
   *
   * @throws ResourceConflictException if the project already has a live budget
   */
  @Transactional
  public Budget create(CreateBudgetRequest request, UUID actorId) {
    if (budgetRepository.existsLiveByProjectId(request.projectId())) {
      throw ResourceConflictException.duplicate(
          "Budget already exists", "projectId", request.projectId());
    }
    var budget =
        new Budget(
            request.projectId(),
            request.initialAmountHt(),
            request.retentionPct(),
            request.alertThresholdPct(),
            request.approvalThresholdHt(),
            request.notes());
    budget = budgetRepository.save(budget);
    log.info(
        "Created budget {} for project {} with initial amount {}",
        budget.getId(),
        budget.getProjectId(),
        budget.getInitialAmountHt());

    var details = new LinkedHashMap<String, Object>();
    details.put("initial_amount_ht", budget.getInitialAmountHt().toPlainString());
    details.put("retention_pct", budget.getRetentionPct().toPlainString());
    details.put("alert_threshold_pct", budget.getAlertThresholdPct().toPlainString());
    journal(budget, AuditAction.CREATE, "Budget created", actorId, details);
    return budget;
  }

  @Transactional
  public Budget update(UUID budgetId, UpdateBudgetRequest request, UUID actorId) {
    var budget = get(budgetId);
    var previousInitial = budget.getInitialAmountHt();
    budget.updateSettings(
        request.initialAmountHt(),
        request.retentionPct(),
        request.alertThresholdPct(),
        request.approvalThresholdHt(),
        request.notes());
    budget = budgetRepository.save(budget);
    log.info("Updated budget {}", budgetId);

    var details = new LinkedHashMap<String, Object>();
    if (previousInitial.compareTo(budget.getInitialAmountHt()) != 0) {
      details.put("initial_amount_ht", budget.getInitialAmountHt().toPlainString());
    }
    journal(budget, AuditAction.UPDATE, "Budget updated", actorId, details);
    return budget;
  }

  @Transactional
  public void delete(UUID budgetId, UUID actorId) {
    var budget = get(budgetId);
    budget.softDelete(actorId);
    budgetRepository.save(budget);
    log.info("Soft-deleted budget {} of project {}", budgetId, budget.getProjectId());
    journal(budget, AuditAction.DELETE, "Budget deleted", actorId, Map.of());
  }

  @Transactional(readOnly = true)
  public Budget get(UUID budgetId) {
    return budgetRepository
        .findLiveById(budgetId)
        .orElseThrow(() -> new ResourceNotFoundException("Budget", budgetId));
  }

  @Transactional(readOnly = true)
  public Budget getByProject(UUID projectId) {
    return budgetRepository
        .findLiveByProjectId(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Budget", projectId));
  }

  @Transactional(readOnly = true)
  public Optional<Budget> findByProject(UUID projectId) {
    return budgetRepository.findLiveByProjectId(projectId);
  }

  /** Envelope plus engaged/realized sums, recomputed on every call. */
  @Transactional(readOnly = true)
  public BudgetStatus getStatus(UUID projectId) {
    var budget = getByProject(projectId);
    return BudgetStatus.compute(
        budget,
        purchaseAggregationService.engagedAmount(projectId),
        purchaseAggregationService.realizedAmount(projectId));
  }

  private void journal(
      Budget budget,
      AuditAction action,
      String detail,
      UUID actorId,
      Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .entityType("budget")
            .entityId(budget.getId())
            .projectId(budget.getProjectId())
            .action(action)
            .detail(detail)
            .actorId(actorId)
            .details(details)
            .build());
  }
}
