package io.b2mash.siteledger.budget;

import io.b2mash.siteledger.audit.AuditAction;
import io.b2mash.siteledger.audit.AuditEventBuilder;
import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.budget.dto.AmendmentRequest;
import io.b2mash.siteledger.exception.InvalidTransitionException;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.sequence.DocumentNumberService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Amendment lifecycle. After every validation or deletion the owning budget's amendment total is
 * re-summed from the repository, so a missed update heals on the next one.
 */
@Service
public class BudgetAmendmentService {

  private static final Logger log = LoggerFactory.getLogger(BudgetAmendmentService.class);

  private final BudgetAmendmentRepository amendmentRepository;
  private final BudgetRepository budgetRepository;
  private final DocumentNumberService documentNumberService;
  private final AuditService auditService;

  public BudgetAmendmentService(
      BudgetAmendmentRepository amendmentRepository,
      BudgetRepository budgetRepository,
      DocumentNumberService documentNumberService,
      AuditService auditService) {
    this.amendmentRepository = amendmentRepository;
    this.budgetRepository = budgetRepository;
    this.documentNumberService = documentNumberService;
    this.auditService = auditService;
  }

  @Transactional
  public BudgetAmendment create(UUID budgetId, AmendmentRequest request, UUID actorId) {
    var budget = requireBudget(budgetId);
    var amendment =
        new BudgetAmendment(
            budgetId,
            documentNumberService.nextAmendmentNumber(budgetId),
            request.reason(),
            request.amountHt(),
            request.impactDescription());
    amendment = amendmentRepository.save(amendment);
    log.info(
        "Created amendment {} ({}) of {} on budget {}",
        amendment.getId(),
        amendment.getNumber(),
        amendment.getAmountHt(),
        budgetId);
    journal(budget, amendment, AuditAction.CREATE, "Amendment " + amendment.getNumber(), actorId);
    return amendment;
  }

  @Transactional
  public BudgetAmendment update(UUID amendmentId, AmendmentRequest request, UUID actorId) {
    var amendment = get(amendmentId);
    amendment.update(request.reason(), request.amountHt(), request.impactDescription());
    amendment = amendmentRepository.save(amendment);
    log.info("Updated amendment {}", amendmentId);
    journal(
        requireBudget(amendment.getBudgetId()),
        amendment,
        AuditAction.UPDATE,
        "Amendment updated",
        actorId);
    return amendment;
  }

  /**
   * Validates a draft amendment and re-sums the budget's validated amendments.
   *
   * @throws InvalidTransitionException if the amendment is already validated
   * @throws io.b2mash.siteledger.exception.BusinessRuleException if the revised budget would go
   *     negative
   */
  @Transactional
  public BudgetAmendment validate(UUID amendmentId, UUID validatorId) {
    var amendment = get(amendmentId);
    if (!amendment.getStatus().canTransitionTo(AmendmentStatus.VALIDATED)) {
      throw new InvalidTransitionException(
          "BudgetAmendment", amendmentId, amendment.getStatus(), AmendmentStatus.VALIDATED);
    }
    var budget = requireBudget(amendment.getBudgetId());
    var projected =
        amendmentRepository.sumValidatedAmounts(budget.getId()).add(amendment.getAmountHt());
    Budget.requireNonNegativeRevised(budget.getInitialAmountHt(), projected);

    amendment.validate(validatorId);
    amendment = amendmentRepository.save(amendment);
    recomputeAmendmentTotal(budget);
    log.info(
        "Validated amendment {} on budget {}; revised amount now {}",
        amendmentId,
        budget.getId(),
        budget.getRevisedAmountHt());
    journal(budget, amendment, AuditAction.VALIDATE, "Amendment validated", validatorId);
    return amendment;
  }

  @Transactional
  public void delete(UUID amendmentId, UUID actorId) {
    var amendment = get(amendmentId);
    amendment.softDelete(actorId);
    amendmentRepository.save(amendment);
    var budget = requireBudget(amendment.getBudgetId());
    recomputeAmendmentTotal(budget);
    log.info("Soft-deleted amendment {}", amendmentId);
    journal(budget, amendment, AuditAction.DELETE, "Amendment deleted", actorId);
  }

  @Transactional(readOnly = true)
  public BudgetAmendment get(UUID amendmentId) {
    return amendmentRepository
        .findLiveById(amendmentId)
        .orElseThrow(() -> new ResourceNotFoundException("BudgetAmendment", amendmentId));
  }

  @Transactional(readOnly = true)
  public List<BudgetAmendment> list(UUID budgetId) {
    requireBudget(budgetId);
    return amendmentRepository.findLiveByBudgetId(budgetId);
  }

  private void recomputeAmendmentTotal(Budget budget) {
    budget.applyAmendmentTotal(amendmentRepository.sumValidatedAmounts(budget.getId()));
    budgetRepository.save(budget);
  }

  private Budget requireBudget(UUID budgetId) {
    return budgetRepository
        .findLiveById(budgetId)
        .orElseThrow(() -> new ResourceNotFoundException("Budget", budgetId));
  }

  private void journal(
      Budget budget, BudgetAmendment amendment, AuditAction action, String detail, UUID actorId) {
    auditService.log(
        AuditEventBuilder.builder()
            .entityType("budget_amendment")
            .entityId(amendment.getId())
            .projectId(budget.getProjectId())
            .action(action)
            .detail(detail)
            .actorId(actorId)
            .details(
                Map.of(
                    "budget_id", String.valueOf(budget.getId()),
                    "amount_ht", amendment.getAmountHt().toPlainString()))
            .build());
  }
}
