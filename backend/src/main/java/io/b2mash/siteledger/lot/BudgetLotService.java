package io.b2mash.siteledger.lot;

import io.b2mash.siteledger.audit.AuditAction;
import io.b2mash.siteledger.audit.AuditEventBuilder;
import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.budget.Budget;
import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.exception.BusinessRuleException;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.ResourceConflictException;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.lot.dto.LotRequest;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BudgetLotService {

  private static final Logger log = LoggerFactory.getLogger(BudgetLotService.class);

  private final BudgetLotRepository lotRepository;
  private final BudgetRepository budgetRepository;
  private final AuditService auditService;

  public BudgetLotService(
      BudgetLotRepository lotRepository,
      BudgetRepository budgetRepository,
      AuditService auditService) {
    this.lotRepository = lotRepository;
    this.budgetRepository = budgetRepository;
    this.auditService = auditService;
  }

  /**
   * Creates a lot under a budget or a quote.
   *
   * @throws ResourceConflictException if the code is already used by a live lot of the same owner
   */
  @Transactional
  public BudgetLot create(LotRequest request, UUID actorId) {
    var lot =
        new BudgetLot(
            request.budgetId(),
            request.quoteId(),
            request.code(),
            request.label(),
            request.plannedQuantity(),
            request.unitPriceHt());
    UUID projectId = null;
    if (lot.getBudgetId() != null) {
      projectId = requireBudget(lot.getBudgetId()).getProjectId();
    }
    requireUniqueCode(lot.getOwnerId(), lot.getCode());
    if (request.parentLotId() != null) {
      requireParent(lot, request.parentLotId());
      lot.setParentLotId(request.parentLotId());
    }
    lot.setUnit(request.unit());
    if (request.position() != null) {
      lot.setPosition(request.position());
    }
    if (request.costBreakdown() != null || request.marginPct() != null) {
      lot.setCostBreakdown(request.costBreakdown(), request.marginPct());
    }
    lot = lotRepository.save(lot);
    log.info(
        "Created {} lot {} ({}) planned {}",
        lot.getPhase(),
        lot.getId(),
        lot.getCode(),
        lot.getPlannedTotalHt());
    journal(lot, projectId, AuditAction.CREATE, "Lot " + lot.getCode() + " created", actorId);
    return lot;
  }

  @Transactional
  public BudgetLot update(UUID lotId, LotRequest request, UUID actorId) {
    var lot = get(lotId);
    if (request.code() != null && !request.code().trim().equals(lot.getCode())) {
      requireUniqueCode(lot.getOwnerId(), request.code().trim());
    }
    if (request.parentLotId() != null && !request.parentLotId().equals(lot.getParentLotId())) {
      requireParent(lot, request.parentLotId());
      lot.setParentLotId(request.parentLotId());
    }
    lot.updateDetails(
        request.code(),
        request.label(),
        request.unit(),
        request.plannedQuantity(),
        request.unitPriceHt(),
        request.position());
    if (request.costBreakdown() != null || request.marginPct() != null) {
      lot.setCostBreakdown(
          request.costBreakdown() != null ? request.costBreakdown() : lot.getCostBreakdown(),
          request.marginPct() != null ? request.marginPct() : lot.getMarginPct());
    }
    lot = lotRepository.save(lot);
    log.info("Updated lot {}", lotId);
    journal(lot, projectIdOf(lot), AuditAction.UPDATE, "Lot updated", actorId);
    return lot;
  }

  /**
   * Tombstones a lot.
   *
   * @throws BusinessRuleException if the lot still has live children
   */
  @Transactional
  public void delete(UUID lotId, UUID actorId) {
    var lot = get(lotId);
    if (lotRepository.hasLiveChildren(lotId)) {
      throw new BusinessRuleException(
          "lot_has_children",
          "Lot has sub-lots",
          "Lot " + lot.getCode() + " still has live sub-lots; delete them first");
    }
    lot.softDelete(actorId);
    lotRepository.save(lot);
    log.info("Soft-deleted lot {}", lotId);
    journal(lot, projectIdOf(lot), AuditAction.DELETE, "Lot deleted", actorId);
  }

  @Transactional(readOnly = true)
  public BudgetLot get(UUID lotId) {
    return lotRepository
        .findLiveById(lotId)
        .orElseThrow(() -> new ResourceNotFoundException("BudgetLot", lotId));
  }

  @Transactional(readOnly = true)
  public List<BudgetLot> listByBudget(UUID budgetId) {
    return lotRepository.findLiveByBudgetId(budgetId);
  }

  @Transactional(readOnly = true)
  public List<BudgetLot> listByQuote(UUID quoteId) {
    return lotRepository.findLiveByQuoteId(quoteId);
  }

  /** Sum of the planned totals of every live lot of the budget. */
  @Transactional(readOnly = true)
  public BigDecimal totalPlanned(UUID budgetId) {
    return lotRepository.sumPlannedTotalByBudgetId(budgetId);
  }

  /** Live lots of a budget as a forest. Orphans whose parent is gone are promoted to roots. */
  @Transactional(readOnly = true)
  public List<LotNode> tree(UUID budgetId) {
    var lots = lotRepository.findLiveByBudgetId(budgetId);
    var ids = lots.stream().map(BudgetLot::getId).toList();
    Map<UUID, List<BudgetLot>> childrenByParent = new HashMap<>();
    var roots = new ArrayList<BudgetLot>();
    for (var lot : lots) {
      if (lot.getParentLotId() != null && ids.contains(lot.getParentLotId())) {
        childrenByParent.computeIfAbsent(lot.getParentLotId(), k -> new ArrayList<>()).add(lot);
      } else {
        roots.add(lot);
      }
    }
    return roots.stream().map(root -> toNode(root, childrenByParent)).toList();
  }

  private LotNode toNode(BudgetLot lot, Map<UUID, List<BudgetLot>> childrenByParent) {
    var children =
        childrenByParent.getOrDefault(lot.getId(), List.of()).stream()
            .map(child -> toNode(child, childrenByParent))
            .toList();
    var rolledUp =
        children.stream()
            .map(LotNode::rolledUpTotalHt)
            .reduce(lot.getPlannedTotalHt(), BigDecimal::add);
    return new LotNode(
        lot.getId(), lot.getCode(), lot.getLabel(), lot.getPlannedTotalHt(), rolledUp, children);
  }

  private void requireUniqueCode(UUID ownerId, String code) {
    if (lotRepository.existsLiveByOwnerAndCode(ownerId, code)) {
      throw ResourceConflictException.duplicate("Duplicate lot code", "code", code);
    }
  }

  private void requireParent(BudgetLot lot, UUID parentLotId) {
    if (parentLotId.equals(lot.getId())) {
      throw InvalidStateException.forField("parentLotId", "A lot cannot be its own parent");
    }
    var parent = get(parentLotId);
    if (!Objects.equals(parent.getOwnerId(), lot.getOwnerId())) {
      throw InvalidStateException.forField(
          "parentLotId", "Parent lot " + parentLotId + " belongs to another budget or quote");
    }
    // Walk up from the new parent to reject cycles.
    var cursor = parent.getParentLotId();
    while (cursor != null && lot.getId() != null) {
      if (cursor.equals(lot.getId())) {
        throw InvalidStateException.forField(
            "parentLotId", "Parent lot " + parentLotId + " is a descendant of this lot");
      }
      cursor = lotRepository.findLiveById(cursor).map(BudgetLot::getParentLotId).orElse(null);
    }
  }

  private Budget requireBudget(UUID budgetId) {
    return budgetRepository
        .findLiveById(budgetId)
        .orElseThrow(() -> new ResourceNotFoundException("Budget", budgetId));
  }

  private UUID projectIdOf(BudgetLot lot) {
    if (lot.getBudgetId() == null) {
      return null;
    }
    return budgetRepository.findById(lot.getBudgetId()).map(Budget::getProjectId).orElse(null);
  }

  private void journal(
      BudgetLot lot, UUID projectId, AuditAction action, String detail, UUID actorId) {
    auditService.log(
        AuditEventBuilder.builder()
            .entityType("budget_lot")
            .entityId(lot.getId())
            .projectId(projectId)
            .action(action)
            .detail(detail)
            .actorId(actorId)
            .details(Map.of("code", lot.getCode(), "phase", lot.getPhase().name()))
            .build());
  }
}
