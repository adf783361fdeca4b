package io.b2mash.siteledger.lot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.siteledger.exception.InvalidStateException;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class BudgetLotTest {

  @Test
  void create_computesPlannedTotal() {
    var lot =
        new BudgetLot(
            UUID.randomUUID(), null, "L02", "Masonry", new BigDecimal("120.5"), new BigDecimal("45"));

    assertThat(lot.getPlannedTotalHt()).isEqualByComparingTo("5422.50");
    assertThat(lot.getPhase()).isEqualTo(LotPhase.SITE);
  }

  @Test
  void create_bothOwners_rejected() {
    assertThatThrownBy(
            () ->
                new BudgetLot(
                    UUID.randomUUID(), UUID.randomUUID(), "L01", "X", BigDecimal.ONE, BigDecimal.ONE))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void create_noOwner_rejected() {
    assertThatThrownBy(() -> new BudgetLot(null, null, "L01", "X", BigDecimal.ONE, BigDecimal.ONE))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void salePrice_appliesMarginOnBreakdown() {
    var lot = new BudgetLot(null, UUID.randomUUID(), "Q01", "Roofing", null, null);
    lot.setCostBreakdown(
        new CostBreakdown(
            new BigDecimal("400"),
            new BigDecimal("300"),
            null,
            new BigDecimal("200"),
            new BigDecimal("100")),
        new BigDecimal("15"));

    assertThat(lot.getPhase()).isEqualTo(LotPhase.QUOTE);
    assertThat(lot.getCostBreakdown().total()).isEqualByComparingTo("1000.00");
    assertThat(lot.getSalePriceHt()).isEqualByComparingTo("1150.00");
  }

  @Test
  void salePrice_withoutMargin_isNull() {
    var lot = new BudgetLot(null, UUID.randomUUID(), "Q01", "Roofing", null, null);
    lot.setCostBreakdown(new CostBreakdown(BigDecimal.TEN, null, null, null, null), null);

    assertThat(lot.getSalePriceHt()).isNull();
  }

  @Test
  void setCostBreakdown_onSiteLot_rejected() {
    var lot =
        new BudgetLot(
            UUID.randomUUID(), null, "L04", "Roofing", new BigDecimal("1"), new BigDecimal("1000"));

    assertThatThrownBy(
            () ->
                lot.setCostBreakdown(
                    new CostBreakdown(new BigDecimal("800"), null, null, null, null),
                    new BigDecimal("15")))
        .isInstanceOf(InvalidStateException.class);
    assertThat(lot.getSalePriceHt()).isNull();
  }

  @Test
  void updateDetails_repricesKeepingOtherValues() {
    var lot =
        new BudgetLot(
            UUID.randomUUID(), null, "L03", "Plumbing", new BigDecimal("10"), new BigDecimal("100"));

    lot.updateDetails(null, null, null, null, new BigDecimal("120"), null);

    assertThat(lot.getPlannedQuantity()).isEqualByComparingTo("10");
    assertThat(lot.getPlannedTotalHt()).isEqualByComparingTo("1200.00");
  }
}
