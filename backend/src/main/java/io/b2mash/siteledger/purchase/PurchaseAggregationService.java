package io.b2mash.siteledger.purchase;

import io.b2mash.siteledger.lot.BudgetLot;
import io.b2mash.siteledger.lot.BudgetLotRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only engaged/realized sums. Nothing is cached: every call re-sums from the purchase order
 * table so that reconciliation overrides written elsewhere are always reflected.
 */
@Service
public class PurchaseAggregationService {

  private final PurchaseOrderRepository purchaseOrderRepository;
  private final BudgetLotRepository lotRepository;

  public PurchaseAggregationService(
      PurchaseOrderRepository purchaseOrderRepository, BudgetLotRepository lotRepository) {
    this.purchaseOrderRepository = purchaseOrderRepository;
    this.lotRepository = lotRepository;
  }

  @Transactional(readOnly = true)
  public BigDecimal engagedAmount(UUID projectId) {
    return purchaseOrderRepository.sumTotalsByProjectAndStatuses(
        projectId, PurchaseOrderStatus.ENGAGED);
  }

  @Transactional(readOnly = true)
  public BigDecimal realizedAmount(UUID projectId) {
    return purchaseOrderRepository.sumTotalsByProjectAndStatuses(
        projectId, PurchaseOrderStatus.REALIZED);
  }

  @Transactional(readOnly = true)
  public BigDecimal engagedAmountForLot(UUID lotId) {
    return purchaseOrderRepository.sumTotalsByLotAndStatuses(lotId, PurchaseOrderStatus.ENGAGED);
  }

  @Transactional(readOnly = true)
  public BigDecimal realizedAmountForLot(UUID lotId) {
    return purchaseOrderRepository.sumTotalsByLotAndStatuses(lotId, PurchaseOrderStatus.REALIZED);
  }

  /** Planned, engaged and realized for every live lot of a budget, in lot order. */
  @Transactional(readOnly = true)
  public List<LotSpending> lotBreakdown(UUID budgetId) {
    var lots = lotRepository.findLiveByBudgetId(budgetId);
    if (lots.isEmpty()) {
      return List.of();
    }
    var lotIds = lots.stream().map(BudgetLot::getId).toList();
    var engaged =
        toMap(purchaseOrderRepository.sumTotalsGroupedByLot(lotIds, PurchaseOrderStatus.ENGAGED));
    var realized =
        toMap(
            purchaseOrderRepository.sumTotalsGroupedByLot(lotIds, PurchaseOrderStatus.REALIZED));
    return lots.stream()
        .map(
            lot ->
                new LotSpending(
                    lot.getId(),
                    lot.getCode(),
                    lot.getLabel(),
                    lot.getPlannedTotalHt(),
                    engaged.getOrDefault(lot.getId(), BigDecimal.ZERO),
                    realized.getOrDefault(lot.getId(), BigDecimal.ZERO)))
        .toList();
  }

  private static Map<UUID, BigDecimal> toMap(List<PurchaseOrderRepository.LotTotal> rows) {
    return rows.stream()
        .collect(
            Collectors.toMap(
                PurchaseOrderRepository.LotTotal::getLotId,
                PurchaseOrderRepository.LotTotal::getTotal));
  }
}
