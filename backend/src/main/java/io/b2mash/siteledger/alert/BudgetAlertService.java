package io.b2mash.siteledger.alert;

import io.b2mash.siteledger.audit.AuditAction;
import io.b2mash.siteledger.audit.AuditEventBuilder;
import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.budget.Budget;
import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.event.BudgetThresholdReachedEvent;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.money.MonetaryCalculator;
import io.b2mash.siteledger.purchase.PurchaseAggregationService;
import io.b2mash.siteledger.sitecost.SiteCostReader;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compares engaged and realized spending against a project's revised budget and appends an alert
 * for every metric at or above the budget's alert threshold. Detection is not idempotent: a breach
 * that persists produces a new row on every run.
 */
@Service
public class BudgetAlertService {

  private static final Logger log = LoggerFactory.getLogger(BudgetAlertService.class);

  private final BudgetAlertRepository alertRepository;
  private final BudgetRepository budgetRepository;
  private final PurchaseAggregationService aggregationService;
  private final SiteCostReader siteCostReader;
  private final ApplicationEventPublisher eventPublisher;
  private final AuditService auditService;

  public BudgetAlertService(
      BudgetAlertRepository alertRepository,
      BudgetRepository budgetRepository,
      PurchaseAggregationService aggregationService,
      SiteCostReader siteCostReader,
      ApplicationEventPublisher eventPublisher,
      AuditService auditService) {
    this.alertRepository = alertRepository;
    this.budgetRepository = budgetRepository;
    this.aggregationService = aggregationService;
    this.siteCostReader = siteCostReader;
    this.eventPublisher = eventPublisher;
    this.auditService = auditService;
  }

  @Transactional
  public List<BudgetAlert> detect(UUID projectId) {
    var budgetOpt = budgetRepository.findLiveByProjectId(projectId);
    if (budgetOpt.isEmpty()) {
      log.debug("No budget for project {}, skipping alert detection", projectId);
      return List.of();
    }
    var budget = budgetOpt.get();
    var revised = budget.getRevisedAmountHt();
    if (revised.signum() <= 0) {
      return List.of();
    }

    var engaged = aggregationService.engagedAmount(projectId);
    var realized =
        aggregationService
            .realizedAmount(projectId)
            .add(siteCostReader.laborCost(projectId))
            .add(siteCostReader.internalEquipmentCost(projectId));

    var created = new ArrayList<BudgetAlert>();
    checkThreshold(budget, BudgetAlertType.ENGAGED_THRESHOLD, engaged).ifPresent(created::add);
    checkThreshold(budget, BudgetAlertType.REALIZED_THRESHOLD, realized).ifPresent(created::add);

    log.info(
        "Alert detection for project {}: engaged={}, realized={}, revised={}, {} alert(s) raised",
        projectId,
        engaged,
        realized,
        revised,
        created.size());
    return created;
  }

  /**
   * Marks an alert as seen.
   *
   * @throws io.b2mash.siteledger.exception.InvalidTransitionException if already acknowledged
   */
  @Transactional
  public BudgetAlert acknowledge(UUID alertId, UUID actorId) {
    var alert =
        alertRepository
            .findById(alertId)
            .orElseThrow(() -> new ResourceNotFoundException("BudgetAlert", alertId));
    alert.acknowledge(actorId);
    alert = alertRepository.save(alert);
    log.info("Alert {} acknowledged by {}", alertId, actorId);
    auditService.log(
        AuditEventBuilder.builder()
            .entityType("budget_alert")
            .entityId(alert.getId())
            .projectId(alert.getProjectId())
            .action(AuditAction.ACKNOWLEDGE)
            .detail(alert.getType().code() + " alert acknowledged")
            .actorId(actorId)
            .build());
    return alert;
  }

  @Transactional(readOnly = true)
  public List<BudgetAlert> listByProject(UUID projectId, boolean unacknowledgedOnly) {
    return unacknowledgedOnly
        ? alertRepository.findUnacknowledgedByProjectId(projectId)
        : alertRepository.findByProjectId(projectId);
  }

  @Transactional(readOnly = true)
  public long countUnacknowledged(UUID projectId) {
    return alertRepository.countUnacknowledgedByProjectId(projectId);
  }

  private Optional<BudgetAlert> checkThreshold(
      Budget budget, BudgetAlertType type, BigDecimal reached) {
    var revised = budget.getRevisedAmountHt();
    var threshold = budget.getAlertThresholdPct();
    if (!MonetaryCalculator.reachesPct(reached, revised, threshold)) {
      return Optional.empty();
    }
    var reachedPct = MonetaryCalculator.percentOf(reached, revised);

    var message =
        "The "
            + type.metric()
            + " amount ("
            + MonetaryCalculator.roundAmount(reached).toPlainString()
            + " HT) reaches "
            + reachedPct.toPlainString()
            + "% of the budget ("
            + revised.toPlainString()
            + " HT). Alert threshold: "
            + threshold.toPlainString()
            + "%.";
    var alert =
        alertRepository.save(
            new BudgetAlert(
                budget.getProjectId(),
                budget.getId(),
                type,
                message,
                reachedPct,
                threshold,
                revised,
                MonetaryCalculator.roundAmount(reached)));
    log.warn(
        "Budget threshold reached: project={}, type={}, reached={}%, threshold={}%",
        budget.getProjectId(),
        type.code(),
        reachedPct,
        threshold);

    eventPublisher.publishEvent(
        new BudgetThresholdReachedEvent(
            alert.getId(),
            budget.getProjectId(),
            budget.getId(),
            type.code(),
            revised,
            alert.getReachedAmountHt(),
            reachedPct,
            threshold,
            Instant.now()));
    return Optional.of(alert);
  }
}
