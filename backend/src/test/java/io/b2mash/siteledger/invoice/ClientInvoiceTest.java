package io.b2mash.siteledger.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.siteledger.exception.BusinessRuleException;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.InvalidTransitionException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ClientInvoiceTest {

  private static ClientInvoice deposit(String amount, String vat, String retention) {
    return new ClientInvoice(
        UUID.randomUUID(),
        null,
        "FAC-2024-0001",
        ClientInvoiceType.DEPOSIT,
        new BigDecimal(amount),
        new BigDecimal(vat),
        new BigDecimal(retention),
        null);
  }

  @Test
  void create_computesAmounts() {
    var invoice = deposit("10000", "20", "5");

    assertThat(invoice.getVatAmount()).isEqualByComparingTo("2000.00");
    assertThat(invoice.getTotalTtc()).isEqualByComparingTo("12000.00");
    assertThat(invoice.getRetentionAmount()).isEqualByComparingTo("500.00");
    assertThat(invoice.getNetPayable()).isEqualByComparingTo("11500.00");
    assertThat(invoice.getStatus()).isEqualTo(ClientInvoiceStatus.DRAFT);
  }

  @Test
  void create_progressWithoutStatement_rejected() {
    assertThatThrownBy(
            () ->
                new ClientInvoice(
                    UUID.randomUUID(),
                    null,
                    "FAC-2024-0002",
                    ClientInvoiceType.PROGRESS,
                    BigDecimal.TEN,
                    new BigDecimal("20"),
                    BigDecimal.ZERO,
                    null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void updateDraft_recomputesAmounts() {
    var invoice = deposit("10000", "20", "5");

    invoice.updateDraft(null, new BigDecimal("10"), null, LocalDate.of(2024, 7, 31), null);

    assertThat(invoice.getVatAmount()).isEqualByComparingTo("1000.00");
    assertThat(invoice.getNetPayable()).isEqualByComparingTo("10500.00");
    assertThat(invoice.getDueDate()).isEqualTo(LocalDate.of(2024, 7, 31));
  }

  @Test
  void updateDraft_afterIssue_rejected() {
    var invoice = deposit("10000", "20", "0");
    invoice.issue(LocalDate.of(2024, 6, 1));

    assertThatThrownBy(() -> invoice.updateDraft(BigDecimal.ONE, null, null, null, null))
        .isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void markPaid_fromIssued_rejected() {
    var invoice = deposit("10000", "20", "0");
    invoice.issue(LocalDate.of(2024, 6, 1));

    assertThatThrownBy(invoice::markPaid).isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void cancel_afterSent_rejected() {
    var invoice = deposit("10000", "20", "0");
    invoice.issue(LocalDate.of(2024, 6, 1));
    invoice.send();

    assertThatThrownBy(invoice::cancel).isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void recordCollection_partialThenFull_marksPaid() {
    var invoice = deposit("1000", "20", "0");
    invoice.issue(LocalDate.of(2024, 6, 1));
    invoice.send();

    assertThat(invoice.recordCollection(new BigDecimal("700"), LocalDate.of(2024, 6, 20)))
        .isFalse();
    assertThat(invoice.getOutstandingAmount()).isEqualByComparingTo("500.00");
    assertThat(invoice.recordCollection(new BigDecimal("500"), LocalDate.of(2024, 7, 5))).isTrue();
    assertThat(invoice.getStatus()).isEqualTo(ClientInvoiceStatus.PAID);
    assertThat(invoice.getCollectedAmount()).isEqualByComparingTo("1200.00");
  }

  @Test
  void recordCollection_onIssued_accumulatesWithoutPaying() {
    var invoice = deposit("1000", "20", "0");
    invoice.issue(LocalDate.of(2024, 6, 1));

    assertThat(invoice.recordCollection(new BigDecimal("1200"), LocalDate.of(2024, 6, 2)))
        .isFalse();
    assertThat(invoice.getStatus()).isEqualTo(ClientInvoiceStatus.ISSUED);
  }

  @Test
  void recordCollection_cancelled_rejected() {
    var invoice = deposit("1000", "20", "0");
    invoice.cancel();

    assertThatThrownBy(() -> invoice.recordCollection(BigDecimal.ONE, LocalDate.of(2024, 6, 2)))
        .isInstanceOf(BusinessRuleException.class);
  }

  @Test
  void recordCollection_negative_rejected() {
    var invoice = deposit("1000", "20", "0");

    assertThatThrownBy(
            () -> invoice.recordCollection(new BigDecimal("-1"), LocalDate.of(2024, 6, 2)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void billedStatuses_areReadOnly() {
    assertThat(ClientInvoiceStatus.BILLED)
        .containsExactlyInAnyOrder(
            ClientInvoiceStatus.ISSUED, ClientInvoiceStatus.SENT, ClientInvoiceStatus.PAID);
    assertThatThrownBy(() -> ClientInvoiceStatus.BILLED.add(ClientInvoiceStatus.DRAFT))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
