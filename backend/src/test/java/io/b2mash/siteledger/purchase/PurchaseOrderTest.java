package io.b2mash.siteledger.purchase;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.InvalidTransitionException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

class PurchaseOrderTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID ACTOR_ID = UUID.randomUUID();

  private PurchaseOrder order(PurchaseType type, String qty, String price, String vat) {
    return new PurchaseOrder(
        PROJECT_ID,
        type,
        "Ready-mix concrete",
        new BigDecimal(qty),
        new BigDecimal(price),
        new BigDecimal(vat),
        ACTOR_ID);
  }

  @Test
  void create_computesTotals() {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");

    assertThat(order.getTotalHt()).isEqualByComparingTo("500.00");
    assertThat(order.getVatAmount()).isEqualByComparingTo("100.00");
    assertThat(order.getTotalTtc()).isEqualByComparingTo("600.00");
    assertThat(order.getStatus()).isEqualTo(PurchaseOrderStatus.REQUESTED);
  }

  @Test
  void create_subcontractingWithVat_rejected() {
    assertThatThrownBy(() -> order(PurchaseType.SUBCONTRACTING, "1", "1000", "20"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void create_illegalVatRate_rejected() {
    assertThatThrownBy(() -> order(PurchaseType.MATERIAL, "1", "100", "19.6"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void create_zeroQuantity_rejected() {
    assertThatThrownBy(() -> order(PurchaseType.MATERIAL, "0", "100", "20"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void fullLifecycle_reachesInvoiced() {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");

    order.approve(ACTOR_ID);
    order.markOrdered();
    order.markReceived();
    order.markInvoiced(" INV-2024-118 ");

    assertThat(order.getStatus()).isEqualTo(PurchaseOrderStatus.INVOICED);
    assertThat(order.getInvoiceReference()).isEqualTo("INV-2024-118");
    assertThat(order.getApprovedBy()).isEqualTo(ACTOR_ID);
    assertThat(order.getApprovedAt()).isNotNull();
  }

  @Test
  void markOrdered_fromRequested_rejected() {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");

    assertThatThrownBy(order::markOrdered).isInstanceOf(InvalidTransitionException.class);
    assertThat(order.getStatus()).isEqualTo(PurchaseOrderStatus.REQUESTED);
  }

  @Test
  void reject_withoutReason_rejectedAndStatusUnchanged() {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");

    assertThatThrownBy(() -> order.reject(ACTOR_ID, "  ")).isInstanceOf(InvalidStateException.class);
    assertThat(order.getStatus()).isEqualTo(PurchaseOrderStatus.REQUESTED);
  }

  @Test
  void reject_fromApproved_allowed() {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");
    order.approve(ACTOR_ID);

    order.reject(ACTOR_ID, "Supplier out of stock");

    assertThat(order.getStatus()).isEqualTo(PurchaseOrderStatus.REJECTED);
    assertThat(order.getRejectionReason()).isEqualTo("Supplier out of stock");
  }

  @Test
  void markInvoiced_withoutReference_rejected() {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");
    order.approve(ACTOR_ID);
    order.markOrdered();
    order.markReceived();

    assertThatThrownBy(() -> order.markInvoiced(null)).isInstanceOf(InvalidStateException.class);
    assertThat(order.getStatus()).isEqualTo(PurchaseOrderStatus.RECEIVED);
  }

  @ParameterizedTest
  @EnumSource(
      value = PurchaseOrderStatus.class,
      names = {"REJECTED", "INVOICED"})
  void terminalStatuses_allowNoTransition(PurchaseOrderStatus status) {
    assertThat(status.isTerminal()).isTrue();
    for (var target : PurchaseOrderStatus.values()) {
      assertThat(status.canTransitionTo(target)).isFalse();
    }
  }

  @Test
  void reprice_toSubcontractingAtZeroVat_appliesTogether() {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");

    order.reprice(PurchaseType.SUBCONTRACTING, null, new BigDecimal("60"), BigDecimal.ZERO);

    assertThat(order.getType()).isEqualTo(PurchaseType.SUBCONTRACTING);
    assertThat(order.getTotalHt()).isEqualByComparingTo("600.00");
    assertThat(order.getVatAmount()).isEqualByComparingTo("0");
    assertThat(order.getTotalTtc()).isEqualByComparingTo("600.00");
  }

  @Test
  void reprice_afterApproval_rejected() {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");
    order.approve(ACTOR_ID);

    assertThatThrownBy(() -> order.reprice(null, BigDecimal.ONE, null, null))
        .isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void assignSupplier_subcontractor_forcesZeroVat() {
    var order = order(PurchaseType.MATERIAL, "2", "1000", "20");

    boolean forced = order.assignSupplier(UUID.randomUUID(), true);

    assertThat(forced).isTrue();
    assertThat(order.getType()).isEqualTo(PurchaseType.SUBCONTRACTING);
    assertThat(order.getVatRate()).isEqualByComparingTo("0");
    assertThat(order.getTotalTtc()).isEqualByComparingTo("2000.00");
  }

  @Test
  void schedule_deliveryBeforeOrder_rejected() {
    var order = order(PurchaseType.MATERIAL, "1", "10", "20");

    assertThatThrownBy(
            () -> order.schedule(LocalDate.of(2024, 5, 10), LocalDate.of(2024, 5, 1)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void effectiveTotal_prefersReconciledAmount() {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");
    assertThat(order.getEffectiveTotalHt()).isEqualByComparingTo("500.00");

    order.applyReconciliation(new BigDecimal("480.5"), LocalDate.of(2024, 6, 3));

    assertThat(order.getEffectiveTotalHt()).isEqualByComparingTo("480.50");
    assertThat(order.getTotalHt()).isEqualByComparingTo("500.00");
  }

  private PurchaseOrder orderIn(PurchaseOrderStatus status) {
    var order = order(PurchaseType.MATERIAL, "10", "50", "20");
    switch (status) {
      case REQUESTED -> {}
      case REJECTED -> order.reject(ACTOR_ID, "Not needed");
      default -> {
        order.approve(ACTOR_ID);
        if (status == PurchaseOrderStatus.APPROVED) {
          break;
        }
        order.markOrdered();
        if (status == PurchaseOrderStatus.ORDERED) {
          break;
        }
        order.markReceived();
        if (status == PurchaseOrderStatus.RECEIVED) {
          break;
        }
        order.markInvoiced("SUP-2024-118");
      }
    }
    return order;
  }

  private static void moveTo(PurchaseOrder order, PurchaseOrderStatus target) {
    switch (target) {
      case APPROVED -> order.approve(ACTOR_ID);
      case REJECTED -> order.reject(ACTOR_ID, "Too late");
      case ORDERED -> order.markOrdered();
      case RECEIVED -> order.markReceived();
      case INVOICED -> order.markInvoiced("SUP-2024-119");
      default -> throw new IllegalArgumentException("No operation leads to " + target);
    }
  }

  /** Every (source, target) pair outside the transition table that an operation can request. */
  static Stream<Arguments> forbiddenTransitions() {
    return Arrays.stream(PurchaseOrderStatus.values())
        .flatMap(
            source ->
                Arrays.stream(PurchaseOrderStatus.values())
                    .filter(target -> target != PurchaseOrderStatus.REQUESTED)
                    .filter(target -> !source.canTransitionTo(target))
                    .map(target -> Arguments.of(source, target)));
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @MethodSource("forbiddenTransitions")
  void forbiddenTransition_throwsAndKeepsStatus(
      PurchaseOrderStatus source, PurchaseOrderStatus target) {
    var order = orderIn(source);

    assertThatThrownBy(() -> moveTo(order, target))
        .isInstanceOf(InvalidTransitionException.class);
    assertThat(order.getStatus()).isEqualTo(source);
  }

  @Test
  void transitionTable_allowsOnlyTheLifecyclePath() {
    long allowed =
        Arrays.stream(PurchaseOrderStatus.values())
            .flatMap(s -> Arrays.stream(PurchaseOrderStatus.values()).filter(s::canTransitionTo))
            .count();

    assertThat(allowed).isEqualTo(6);
    assertThat(PurchaseOrderStatus.REQUESTED.canTransitionTo(PurchaseOrderStatus.APPROVED))
        .isTrue();
    assertThat(PurchaseOrderStatus.REQUESTED.canTransitionTo(PurchaseOrderStatus.REJECTED))
        .isTrue();
    assertThat(PurchaseOrderStatus.APPROVED.canTransitionTo(PurchaseOrderStatus.ORDERED)).isTrue();
    assertThat(PurchaseOrderStatus.APPROVED.canTransitionTo(PurchaseOrderStatus.REJECTED))
        .isTrue();
    assertThat(PurchaseOrderStatus.ORDERED.canTransitionTo(PurchaseOrderStatus.RECEIVED)).isTrue();
    assertThat(PurchaseOrderStatus.RECEIVED.canTransitionTo(PurchaseOrderStatus.INVOICED))
        .isTrue();
  }
}
