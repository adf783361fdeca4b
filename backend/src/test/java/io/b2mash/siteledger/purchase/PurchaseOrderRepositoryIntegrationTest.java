package io.b2mash.siteledger.purchase;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.siteledger.TestcontainersConfiguration;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/** Runs the aggregation queries against PostgreSQL, where soft deletion and COALESCE apply. */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
class PurchaseOrderRepositoryIntegrationTest {

  private static final UUID ACTOR_ID = UUID.randomUUID();

  @Autowired private PurchaseOrderRepository purchaseOrderRepository;
  @Autowired private TransactionTemplate transactionTemplate;
  @Autowired private JdbcTemplate jdbcTemplate;

  private UUID projectId;
  private UUID lotId;

  @BeforeEach
  void setUp() {
    projectId = UUID.randomUUID();
    var budgetId = UUID.randomUUID();
    lotId = UUID.randomUUID();
    jdbcTemplate.update(
        "INSERT INTO budgets (id, project_id, initial_amount_ht) VALUES (?, ?, 100000)",
        budgetId,
        projectId);
    jdbcTemplate.update(
        "INSERT INTO budget_lots (id, budget_id, code, label)"
            + " VALUES (?, ?, 'LOT-01', 'Gros oeuvre')",
        lotId,
        budgetId);
  }

  private PurchaseOrder order(String unitPrice, PurchaseOrderStatus target) {
    var order =
        new PurchaseOrder(
            projectId,
            PurchaseType.MATERIAL,
            "Béton C25/30",
            BigDecimal.ONE,
            new BigDecimal(unitPrice),
            new BigDecimal("20"),
            ACTOR_ID);
    order.assignLot(lotId);
    advance(order, target);
    return order;
  }

  private static void advance(PurchaseOrder order, PurchaseOrderStatus target) {
    if (target == PurchaseOrderStatus.REQUESTED) {
      return;
    }
    order.approve(ACTOR_ID);
    if (target == PurchaseOrderStatus.APPROVED) {
      return;
    }
    order.markOrdered();
    if (target == PurchaseOrderStatus.ORDERED) {
      return;
    }
    order.markReceived();
    if (target == PurchaseOrderStatus.RECEIVED) {
      return;
    }
    order.markInvoiced("FAC-FOURN-0042");
  }

  private void saveAll(PurchaseOrder... orders) {
    transactionTemplate.executeWithoutResult(
        tx -> purchaseOrderRepository.saveAll(List.of(orders)));
  }

  @Test
  void sumTotals_noOrders_returnsZero() {
    var total =
        purchaseOrderRepository.sumTotalsByProjectAndStatuses(
            projectId, PurchaseOrderStatus.ENGAGED);

    assertThat(total).isEqualByComparingTo("0");
  }

  @Test
  void sumTotals_prefersReconciledAmountAndSkipsDeletedOrders() {
    var approved = order("1000.00", PurchaseOrderStatus.APPROVED);
    var invoiced = order("2000.00", PurchaseOrderStatus.INVOICED);
    invoiced.applyReconciliation(new BigDecimal("2150.40"), LocalDate.of(2025, 3, 31));
    var deleted = order("5000.00", PurchaseOrderStatus.ORDERED);
    deleted.softDelete(ACTOR_ID);
    var requested = order("700.00", PurchaseOrderStatus.REQUESTED);
    saveAll(approved, invoiced, deleted, requested);

    assertThat(
            purchaseOrderRepository.sumTotalsByProjectAndStatuses(
                projectId, PurchaseOrderStatus.ENGAGED))
        .isEqualByComparingTo("3150.40");
    assertThat(
            purchaseOrderRepository.sumTotalsByProjectAndStatuses(
                projectId, PurchaseOrderStatus.REALIZED))
        .isEqualByComparingTo("2150.40");
    assertThat(
            purchaseOrderRepository.sumTotalsByLotAndStatuses(lotId, PurchaseOrderStatus.ENGAGED))
        .isEqualByComparingTo("3150.40");
  }

  @Test
  void sumTotalsGroupedByLot_returnsOneRowPerLotWithSpend() {
    var otherLot = UUID.randomUUID();
    saveAll(
        order("1200.00", PurchaseOrderStatus.ORDERED),
        order("300.00", PurchaseOrderStatus.RECEIVED));

    var rows =
        purchaseOrderRepository.sumTotalsGroupedByLot(
            List.of(lotId, otherLot), PurchaseOrderStatus.ENGAGED);

    assertThat(rows)
        .singleElement()
        .satisfies(
            row -> {
              assertThat(row.getLotId()).isEqualTo(lotId);
              assertThat(row.getTotal()).isEqualByComparingTo("1500.00");
            });
  }

  @Test
  void findLive_excludesDeletedOrders() {
    var kept = order("100.00", PurchaseOrderStatus.REQUESTED);
    var deleted = order("200.00", PurchaseOrderStatus.REQUESTED);
    deleted.softDelete(ACTOR_ID);
    saveAll(kept, deleted);

    assertThat(purchaseOrderRepository.findLiveByProjectId(projectId))
        .extracting(PurchaseOrder::getId)
        .containsExactly(kept.getId());
    assertThat(purchaseOrderRepository.findLiveById(deleted.getId())).isEmpty();
  }
}
