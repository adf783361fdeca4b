package io.b2mash.siteledger.invoice;

import static io.b2mash.siteledger.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.exception.BusinessRuleException;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.ResourceConflictException;
import io.b2mash.siteledger.invoice.dto.CreateInvoiceRequest;
import io.b2mash.siteledger.progress.ProgressStatement;
import io.b2mash.siteledger.progress.ProgressStatementLine;
import io.b2mash.siteledger.progress.ProgressStatementRepository;
import io.b2mash.siteledger.progress.ProgressStatementStatus;
import io.b2mash.siteledger.sequence.DocumentNumberService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ClientInvoiceServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID ACTOR_ID = UUID.randomUUID();

  @Mock private ClientInvoiceRepository invoiceRepository;
  @Mock private ProgressStatementRepository statementRepository;
  @Mock private DocumentNumberService documentNumberService;
  @Mock private AuditService auditService;

  private ClientInvoiceService service;

  @BeforeEach
  void setUp() {
    var clock = Clock.fixed(Instant.parse("2024-06-14T09:00:00Z"), ZoneOffset.UTC);
    service =
        new ClientInvoiceService(
            invoiceRepository, statementRepository, documentNumberService, auditService, clock);
  }

  /** A statement billed at 7000 cumulative, 5% retention, 20% VAT. */
  private ProgressStatement statement(ProgressStatementStatus target) {
    var statement =
        withId(
            new ProgressStatement(
                PROJECT_ID,
                UUID.randomUUID(),
                "SIT-2024-002",
                LocalDate.of(2024, 5, 1),
                LocalDate.of(2024, 5, 31),
                new BigDecimal("5"),
                null,
                ACTOR_ID));
    statement.recomputeTotals(
        List.of(
            new ProgressStatementLine(
                statement.getId(),
                UUID.randomUUID(),
                new BigDecimal("10000"),
                new BigDecimal("4000"),
                new BigDecimal("70"))));
    if (target == ProgressStatementStatus.DRAFT) {
      return statement;
    }
    statement.submitForReview();
    statement.issue(ACTOR_ID);
    if (target == ProgressStatementStatus.ISSUED) {
      return statement;
    }
    statement.markClientValidated();
    return statement;
  }

  private void mockInvoiceSave() {
    when(invoiceRepository.save(any(ClientInvoice.class)))
        .thenAnswer(
            invocation -> {
              ClientInvoice invoice = invocation.getArgument(0);
              return invoice.getId() == null ? withId(invoice) : invoice;
            });
  }

  @Test
  void createFromStatement_copiesCumulativeAmountAndRates() {
    var statement = statement(ProgressStatementStatus.CLIENT_VALIDATED);
    when(statementRepository.findLiveById(statement.getId())).thenReturn(Optional.of(statement));
    when(invoiceRepository.existsActiveByStatementId(statement.getId())).thenReturn(false);
    when(documentNumberService.nextInvoiceNumber()).thenReturn("FAC-2024-0042");
    mockInvoiceSave();

    var invoice = service.createFromStatement(statement.getId(), ACTOR_ID);

    assertThat(invoice.getType()).isEqualTo(ClientInvoiceType.PROGRESS);
    assertThat(invoice.getNumber()).isEqualTo("FAC-2024-0042");
    assertThat(invoice.getStatementId()).isEqualTo(statement.getId());
    assertThat(invoice.getAmountHt()).isEqualByComparingTo("7000.00");
    assertThat(invoice.getRetentionAmount()).isEqualByComparingTo("350.00");
    assertThat(invoice.getNetPayable()).isEqualByComparingTo("8050.00");
  }

  @Test
  void createFromStatement_notClientValidated_rejected() {
    var statement = statement(ProgressStatementStatus.ISSUED);
    when(statementRepository.findLiveById(statement.getId())).thenReturn(Optional.of(statement));

    assertThatThrownBy(() -> service.createFromStatement(statement.getId(), ACTOR_ID))
        .isInstanceOf(BusinessRuleException.class);
    verify(documentNumberService, never()).nextInvoiceNumber();
  }

  @Test
  void createFromStatement_alreadyInvoiced_conflict() {
    var statement = statement(ProgressStatementStatus.CLIENT_VALIDATED);
    when(statementRepository.findLiveById(statement.getId())).thenReturn(Optional.of(statement));
    when(invoiceRepository.existsActiveByStatementId(statement.getId())).thenReturn(true);

    assertThatThrownBy(() -> service.createFromStatement(statement.getId(), ACTOR_ID))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void createStandalone_progressType_rejected() {
    var request =
        new CreateInvoiceRequest(
            PROJECT_ID, ClientInvoiceType.PROGRESS, BigDecimal.TEN, null, null, null, null);

    assertThatThrownBy(() -> service.createStandalone(request, ACTOR_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void createStandalone_deposit_defaultsVatAndRetention() {
    when(documentNumberService.nextInvoiceNumber()).thenReturn("FAC-2024-0043");
    mockInvoiceSave();
    var request =
        new CreateInvoiceRequest(
            PROJECT_ID,
            ClientInvoiceType.DEPOSIT,
            new BigDecimal("30000"),
            null,
            null,
            LocalDate.of(2024, 7, 15),
            "30% deposit");

    var invoice = service.createStandalone(request, ACTOR_ID);

    assertThat(invoice.getVatRate()).isEqualByComparingTo("20");
    assertThat(invoice.getRetentionPct()).isEqualByComparingTo("0");
    assertThat(invoice.getTotalTtc()).isEqualByComparingTo("36000.00");
    assertThat(invoice.getDueDate()).isEqualTo(LocalDate.of(2024, 7, 15));
  }

  @Test
  void issue_stampsIssueDateFromClock() {
    var invoice =
        withId(
            new ClientInvoice(
                PROJECT_ID,
                null,
                "FAC-2024-0044",
                ClientInvoiceType.FINAL,
                new BigDecimal("5000"),
                new BigDecimal("20"),
                BigDecimal.ZERO,
                ACTOR_ID));
    when(invoiceRepository.findLiveById(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceRepository.save(invoice)).thenReturn(invoice);

    service.issue(invoice.getId(), ACTOR_ID);

    assertThat(invoice.getStatus()).isEqualTo(ClientInvoiceStatus.ISSUED);
    assertThat(invoice.getIssueDate()).isEqualTo(LocalDate.of(2024, 6, 14));
  }

  @Test
  void markPaid_advancesClientValidatedStatement() {
    var statement = statement(ProgressStatementStatus.CLIENT_VALIDATED);
    var invoice =
        withId(
            new ClientInvoice(
                PROJECT_ID,
                statement.getId(),
                "FAC-2024-0045",
                ClientInvoiceType.PROGRESS,
                statement.getCumulativeAmountHt(),
                statement.getVatRate(),
                statement.getRetentionPct(),
                ACTOR_ID));
    invoice.issue(LocalDate.of(2024, 6, 1));
    invoice.send();
    when(invoiceRepository.findLiveById(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceRepository.save(invoice)).thenReturn(invoice);
    when(statementRepository.findLiveById(statement.getId())).thenReturn(Optional.of(statement));

    service.markPaid(invoice.getId(), ACTOR_ID);

    assertThat(invoice.getStatus()).isEqualTo(ClientInvoiceStatus.PAID);
    assertThat(statement.getStatus()).isEqualTo(ProgressStatementStatus.INVOICED);
    assertThat(statement.getInvoicedAt()).isNotNull();
    verify(statementRepository).save(statement);
  }

  @Test
  void recordCollection_fullAmount_paysAndAdvancesStatement() {
    var statement = statement(ProgressStatementStatus.CLIENT_VALIDATED);
    var invoice =
        withId(
            new ClientInvoice(
                PROJECT_ID,
                statement.getId(),
                "FAC-2024-0046",
                ClientInvoiceType.PROGRESS,
                statement.getCumulativeAmountHt(),
                statement.getVatRate(),
                statement.getRetentionPct(),
                ACTOR_ID));
    invoice.issue(LocalDate.of(2024, 6, 1));
    invoice.send();
    when(invoiceRepository.findLiveById(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceRepository.save(invoice)).thenReturn(invoice);
    when(statementRepository.findLiveById(statement.getId())).thenReturn(Optional.of(statement));

    service.recordCollection(invoice.getId(), new BigDecimal("8050.00"), LocalDate.of(2024, 7, 1));

    assertThat(invoice.getStatus()).isEqualTo(ClientInvoiceStatus.PAID);
    assertThat(statement.getStatus()).isEqualTo(ProgressStatementStatus.INVOICED);
  }

  @Test
  void recordCollection_partial_leavesStatementAlone() {
    var invoice =
        withId(
            new ClientInvoice(
                PROJECT_ID,
                UUID.randomUUID(),
                "FAC-2024-0047",
                ClientInvoiceType.PROGRESS,
                new BigDecimal("7000"),
                new BigDecimal("20"),
                new BigDecimal("5"),
                ACTOR_ID));
    invoice.issue(LocalDate.of(2024, 6, 1));
    invoice.send();
    when(invoiceRepository.findLiveById(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceRepository.save(invoice)).thenReturn(invoice);

    service.recordCollection(invoice.getId(), new BigDecimal("4000"), LocalDate.of(2024, 7, 1));

    assertThat(invoice.getStatus()).isEqualTo(ClientInvoiceStatus.SENT);
    verify(statementRepository, never()).findLiveById(any());
  }

  private ClientInvoice sentInvoice(String number) {
    var invoice =
        withId(
            new ClientInvoice(
                PROJECT_ID,
                null,
                number,
                ClientInvoiceType.FINAL,
                new BigDecimal("1000"),
                new BigDecimal("20"),
                BigDecimal.ZERO,
                ACTOR_ID));
    invoice.issue(LocalDate.of(2024, 6, 1));
    invoice.send();
    return invoice;
  }

  @Test
  void recordCollection_negativeAmount_rejectedWithoutSaving() {
    var invoice = sentInvoice("FAC-2024-0048");
    when(invoiceRepository.findLiveById(invoice.getId())).thenReturn(Optional.of(invoice));

    assertThatThrownBy(
            () ->
                service.recordCollection(
                    invoice.getId(), new BigDecimal("-0.01"), LocalDate.of(2024, 7, 1)))
        .isInstanceOf(InvalidStateException.class);
    assertThat(invoice.getCollectedAmount()).isNull();
    verify(invoiceRepository, never()).save(any());
    verify(auditService, never()).log(any());
  }

  @Test
  void recordCollection_zeroAmount_changesNothing() {
    var invoice = sentInvoice("FAC-2024-0049");
    when(invoiceRepository.findLiveById(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceRepository.save(invoice)).thenReturn(invoice);

    service.recordCollection(invoice.getId(), BigDecimal.ZERO, LocalDate.of(2024, 7, 1));

    assertThat(invoice.getCollectedAmount()).isEqualByComparingTo("0");
    assertThat(invoice.getStatus()).isEqualTo(ClientInvoiceStatus.SENT);
  }

  @Test
  void recordCollection_cancelledInvoice_rejected() {
    var invoice =
        withId(
            new ClientInvoice(
                PROJECT_ID,
                null,
                "FAC-2024-0050",
                ClientInvoiceType.FINAL,
                new BigDecimal("1000"),
                new BigDecimal("20"),
                BigDecimal.ZERO,
                ACTOR_ID));
    invoice.cancel();
    when(invoiceRepository.findLiveById(invoice.getId())).thenReturn(Optional.of(invoice));

    assertThatThrownBy(
            () ->
                service.recordCollection(
                    invoice.getId(), new BigDecimal("100"), LocalDate.of(2024, 7, 1)))
        .isInstanceOf(BusinessRuleException.class);
    verify(invoiceRepository, never()).save(any());
  }

  @Test
  void cancel_releasesStatementForANewInvoice() {
    var statement = statement(ProgressStatementStatus.CLIENT_VALIDATED);
    var first =
        withId(
            new ClientInvoice(
                PROJECT_ID,
                statement.getId(),
                "FAC-2024-0051",
                ClientInvoiceType.PROGRESS,
                statement.getCumulativeAmountHt(),
                statement.getVatRate(),
                statement.getRetentionPct(),
                ACTOR_ID));
    when(invoiceRepository.findLiveById(first.getId())).thenReturn(Optional.of(first));
    when(statementRepository.findLiveById(statement.getId())).thenReturn(Optional.of(statement));
    when(invoiceRepository.existsActiveByStatementId(statement.getId())).thenReturn(false);
    when(documentNumberService.nextInvoiceNumber()).thenReturn("FAC-2024-0052");
    mockInvoiceSave();

    service.cancel(first.getId(), ACTOR_ID);
    var replacement = service.createFromStatement(statement.getId(), ACTOR_ID);

    assertThat(first.getStatus()).isEqualTo(ClientInvoiceStatus.CANCELLED);
    assertThat(statement.getStatus()).isEqualTo(ProgressStatementStatus.CLIENT_VALIDATED);
    assertThat(replacement.getNumber()).isEqualTo("FAC-2024-0052");
    assertThat(replacement.getStatementId()).isEqualTo(statement.getId());
  }
}
