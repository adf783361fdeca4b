package io.b2mash.siteledger.progress;

import io.b2mash.siteledger.audit.AuditAction;
import io.b2mash.siteledger.audit.AuditEventBuilder;
import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.lot.BudgetLot;
import io.b2mash.siteledger.lot.BudgetLotRepository;
import io.b2mash.siteledger.progress.dto.CreateStatementRequest;
import io.b2mash.siteledger.progress.dto.UpdateStatementRequest;
import io.b2mash.siteledger.sequence.DocumentNumberService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Progress billing ledger. Each new statement carries forward, per lot, the cumulative amount of
 * the project's latest statement that has passed internal validation.
 */
@Service
public class ProgressStatementService {

  private static final Logger log = LoggerFactory.getLogger(ProgressStatementService.class);

  private static final String ENTITY_TYPE = "progress_statement";

  private final ProgressStatementRepository statementRepository;
  private final ProgressStatementLineRepository lineRepository;
  private final BudgetRepository budgetRepository;
  private final BudgetLotRepository lotRepository;
  private final DocumentNumberService documentNumberService;
  private final AuditService auditService;

  public ProgressStatementService(
      ProgressStatementRepository statementRepository,
      ProgressStatementLineRepository lineRepository,
      BudgetRepository budgetRepository,
      BudgetLotRepository lotRepository,
      DocumentNumberService documentNumberService,
      AuditService auditService) {
    this.statementRepository = statementRepository;
    this.lineRepository = lineRepository;
    this.budgetRepository = budgetRepository;
    this.lotRepository = lotRepository;
    this.documentNumberService = documentNumberService;
    this.auditService = auditService;
  }

  /**
   * Creates a draft statement with one line per live lot of the budget.
   *
   * @throws ResourceNotFoundException if the budget does not exist
   * @throws InvalidStateException if the budget belongs to another project, the period is
   *     inverted, or a progress value targets an unknown lot
   */
  @Transactional
  public StatementDetail create(CreateStatementRequest request, UUID actorId) {
    var budget =
        budgetRepository
            .findLiveById(request.budgetId())
            .orElseThrow(() -> new ResourceNotFoundException("Budget", request.budgetId()));
    if (!budget.getProjectId().equals(request.projectId())) {
      throw InvalidStateException.forField(
          "budgetId",
          "Budget " + budget.getId() + " does not belong to project " + request.projectId());
    }

    var lots = lotRepository.findLiveByBudgetId(budget.getId());
    Map<UUID, BigDecimal> progress =
        request.progressByLot() != null ? request.progressByLot() : Map.of();
    requireKnownLots(progress.keySet(), lots);

    var carried = carriedForward(request.projectId());

    var statement =
        new ProgressStatement(
            request.projectId(),
            budget.getId(),
            documentNumberService.nextStatementNumber(request.projectId()),
            request.periodStart(),
            request.periodEnd(),
            request.retentionPct() != null ? request.retentionPct() : budget.getRetentionPct(),
            request.vatRate(),
            actorId);
    statement.setNotes(request.notes());
    statement = statementRepository.save(statement);

    var statementId = statement.getId();
    var lines =
        lots.stream()
            .map(
                lot ->
                    new ProgressStatementLine(
                        statementId,
                        lot.getId(),
                        lot.getPlannedTotalHt(),
                        carried.getOrDefault(lot.getId(), BigDecimal.ZERO),
                        progress.get(lot.getId())))
            .toList();
    lines = lineRepository.saveAll(lines);
    warnOnRegressions(statement, lines);

    statement.recomputeTotals(lines);
    statement = statementRepository.save(statement);
    log.info(
        "Created progress statement {} ({}) for project {}: cumulative {}, period {}",
        statement.getId(),
        statement.getNumber(),
        statement.getProjectId(),
        statement.getCumulativeAmountHt(),
        statement.getPeriodAmountHt());
    journal(
        statement,
        AuditAction.CREATE,
        "Statement " + statement.getNumber() + " created",
        actorId);
    return new StatementDetail(statement, lines);
  }

  /**
   * Edits a draft statement. Lines keep the previous cumulative captured at creation; only
   * progress and derived amounts change.
   */
  @Transactional
  public StatementDetail update(UUID statementId, UpdateStatementRequest request, UUID actorId) {
    var statement = get(statementId);
    statement.updateHeader(
        request.periodStart(),
        request.periodEnd(),
        request.retentionPct(),
        request.vatRate(),
        request.notes());

    var lines = lineRepository.findByStatementId(statementId);
    if (request.progressByLot() != null) {
      var lineLots =
          lines.stream().map(ProgressStatementLine::getLotId).collect(Collectors.toSet());
      for (var lotId : request.progressByLot().keySet()) {
        if (!lineLots.contains(lotId)) {
          throw InvalidStateException.forField(
              "progressByLot", "Lot " + lotId + " has no line on statement " + statementId);
        }
      }
      for (var line : lines) {
        if (request.progressByLot().containsKey(line.getLotId())) {
          line.applyProgress(request.progressByLot().get(line.getLotId()));
        }
      }
      lines = lineRepository.saveAll(lines);
      warnOnRegressions(statement, lines);
    }

    statement.recomputeTotals(lines);
    statement = statementRepository.save(statement);
    log.info("Updated progress statement {}", statementId);
    journal(statement, AuditAction.UPDATE, "Statement updated", actorId);
    return new StatementDetail(statement, lines);
  }

  @Transactional
  public ProgressStatement submit(UUID statementId, UUID actorId) {
    var statement = get(statementId);
    statement.submitForReview();
    statement = statementRepository.save(statement);
    log.info("Progress statement {} submitted for review", statementId);
    journal(statement, AuditAction.UPDATE, "Submitted for review", actorId);
    return statement;
  }

  @Transactional
  public ProgressStatement issue(UUID statementId, UUID validatorId) {
    var statement = get(statementId);
    statement.issue(validatorId);
    statement = statementRepository.save(statement);
    log.info("Progress statement {} issued by {}", statementId, validatorId);
    journal(statement, AuditAction.ISSUE, "Statement issued", validatorId);
    return statement;
  }

  @Transactional
  public ProgressStatement markClientValidated(UUID statementId, UUID actorId) {
    var statement = get(statementId);
    statement.markClientValidated();
    statement = statementRepository.save(statement);
    log.info("Progress statement {} validated by client", statementId);
    journal(statement, AuditAction.VALIDATE, "Validated by client", actorId);
    return statement;
  }

  @Transactional
  public ProgressStatement markInvoiced(UUID statementId, Instant invoicedAt, UUID actorId) {
    var statement = get(statementId);
    statement.markInvoiced(invoicedAt);
    statement = statementRepository.save(statement);
    log.info("Progress statement {} invoiced at {}", statementId, statement.getInvoicedAt());
    journal(statement, AuditAction.INVOICE, "Statement invoiced", actorId);
    return statement;
  }

  @Transactional
  public void delete(UUID statementId, UUID actorId) {
    var statement = get(statementId);
    statement.softDelete(actorId);
    statementRepository.save(statement);
    log.info("Soft-deleted progress statement {}", statementId);
    journal(statement, AuditAction.DELETE, "Statement deleted", actorId);
  }

  @Transactional(readOnly = true)
  public ProgressStatement get(UUID statementId) {
    return statementRepository
        .findLiveById(statementId)
        .orElseThrow(() -> new ResourceNotFoundException("ProgressStatement", statementId));
  }

  @Transactional(readOnly = true)
  public List<ProgressStatement> listByProject(UUID projectId) {
    return statementRepository.findLiveByProjectId(projectId);
  }

  @Transactional(readOnly = true)
  public List<ProgressStatementLine> lines(UUID statementId) {
    get(statementId);
    return lineRepository.findByStatementId(statementId);
  }

  /** Cumulative amount per lot of the latest statement validated for billing, or empty. */
  private Map<UUID, BigDecimal> carriedForward(UUID projectId) {
    var previous =
        statementRepository.findFirstByProjectIdAndStatusInAndDeletedAtIsNullOrderByCreatedAtDesc(
            projectId, ProgressStatementStatus.VALIDATED_FOR_BILLING);
    if (previous.isEmpty()) {
      return Map.of();
    }
    var carried = new HashMap<UUID, BigDecimal>();
    for (var line : lineRepository.findByStatementId(previous.get().getId())) {
      carried.put(line.getLotId(), line.getCumulativeAmountHt());
    }
    log.debug(
        "Carrying forward {} lot(s) from statement {}", carried.size(), previous.get().getNumber());
    return carried;
  }

  private static void requireKnownLots(Set<UUID> lotIds, List<BudgetLot> lots) {
    var known = lots.stream().map(BudgetLot::getId).collect(Collectors.toSet());
    for (var lotId : lotIds) {
      if (!known.contains(lotId)) {
        throw InvalidStateException.forField(
            "progressByLot", "Lot " + lotId + " is not a live lot of this budget");
      }
    }
  }

  private static void warnOnRegressions(
      ProgressStatement statement, List<ProgressStatementLine> lines) {
    for (var line : lines) {
      if (line.isRegression()) {
        log.warn(
            "Statement {} lot {} regresses: period amount {}",
            statement.getNumber(),
            line.getLotId(),
            line.getPeriodAmountHt());
      }
    }
  }

  private void journal(
      ProgressStatement statement, AuditAction action, String detail, UUID actorId) {
    auditService.log(
        AuditEventBuilder.builder()
            .entityType(ENTITY_TYPE)
            .entityId(statement.getId())
            .projectId(statement.getProjectId())
            .action(action)
            .detail(detail)
            .actorId(actorId)
            .details(
                Map.of(
                    "number", String.valueOf(statement.getNumber()),
                    "status", statement.getStatus().name(),
                    "cumulative_amount_ht", statement.getCumulativeAmountHt().toPlainString()))
            .build());
  }
}
