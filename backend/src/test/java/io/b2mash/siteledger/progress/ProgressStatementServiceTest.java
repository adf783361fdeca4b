package io.b2mash.siteledger.progress;

import static io.b2mash.siteledger.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.budget.Budget;
import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.InvalidTransitionException;
import io.b2mash.siteledger.lot.BudgetLot;
import io.b2mash.siteledger.lot.BudgetLotRepository;
import io.b2mash.siteledger.progress.dto.CreateStatementRequest;
import io.b2mash.siteledger.progress.dto.UpdateStatementRequest;
import io.b2mash.siteledger.sequence.DocumentNumberService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProgressStatementServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID ACTOR_ID = UUID.randomUUID();

  @Mock private ProgressStatementRepository statementRepository;
  @Mock private ProgressStatementLineRepository lineRepository;
  @Mock private BudgetRepository budgetRepository;
  @Mock private BudgetLotRepository lotRepository;
  @Mock private DocumentNumberService documentNumberService;
  @Mock private AuditService auditService;

  private ProgressStatementService service;
  private Budget budget;
  private BudgetLot lot;

  @BeforeEach
  void setUp() {
    service =
        new ProgressStatementService(
            statementRepository,
            lineRepository,
            budgetRepository,
            lotRepository,
            documentNumberService,
            auditService);
    budget = withId(new Budget(PROJECT_ID, new BigDecimal("10000"), null, null, null, null));
    lot =
        withId(
            new BudgetLot(
                budget.getId(),
                null,
                "L01",
                "Structural works",
                BigDecimal.ONE,
                new BigDecimal("10000")));
  }

  private CreateStatementRequest request(String progress) {
    return new CreateStatementRequest(
        PROJECT_ID,
        budget.getId(),
        LocalDate.of(2024, 3, 1),
        LocalDate.of(2024, 3, 31),
        null,
        null,
        Map.of(lot.getId(), new BigDecimal(progress)),
        null);
  }

  private void mockCreatePath(Optional<ProgressStatement> previous) {
    when(budgetRepository.findLiveById(budget.getId())).thenReturn(Optional.of(budget));
    when(lotRepository.findLiveByBudgetId(budget.getId())).thenReturn(List.of(lot));
    when(statementRepository.findFirstByProjectIdAndStatusInAndDeletedAtIsNullOrderByCreatedAtDesc(
            eq(PROJECT_ID), any()))
        .thenReturn(previous);
    when(documentNumberService.nextStatementNumber(PROJECT_ID)).thenReturn("SIT-2024-001");
    when(statementRepository.save(any(ProgressStatement.class)))
        .thenAnswer(
            invocation -> {
              ProgressStatement statement = invocation.getArgument(0);
              return statement.getId() == null ? withId(statement) : statement;
            });
    when(lineRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
  }

  @Test
  void create_firstStatement_periodEqualsCumulative() {
    mockCreatePath(Optional.empty());

    var detail = service.create(request("40"), ACTOR_ID);

    var statement = detail.statement();
    assertThat(statement.getNumber()).isEqualTo("SIT-2024-001");
    assertThat(statement.getCumulativeAmountHt()).isEqualByComparingTo("4000.00");
    assertThat(statement.getPeriodAmountHt()).isEqualByComparingTo("4000.00");
    assertThat(statement.getPreviousCumulativeHt()).isEqualByComparingTo("0");
    assertThat(statement.getRetentionPct()).isEqualByComparingTo("5");
    assertThat(statement.getRetentionAmount()).isEqualByComparingTo("200.00");
    assertThat(statement.getVatAmount()).isEqualByComparingTo("800.00");
    assertThat(statement.getTotalTtc()).isEqualByComparingTo("4800.00");
    assertThat(statement.getNetPayable()).isEqualByComparingTo("4600.00");
    assertThat(detail.lines()).hasSize(1);
  }

  @Test
  void create_secondStatement_carriesForwardPreviousCumulative() {
    var previous =
        withId(
            new ProgressStatement(
                PROJECT_ID,
                budget.getId(),
                "SIT-2024-001",
                LocalDate.of(2024, 2, 1),
                LocalDate.of(2024, 2, 29),
                new BigDecimal("5"),
                null,
                ACTOR_ID));
    var previousLine =
        new ProgressStatementLine(
            previous.getId(),
            lot.getId(),
            new BigDecimal("10000"),
            BigDecimal.ZERO,
            new BigDecimal("40"));
    mockCreatePath(Optional.of(previous));
    when(lineRepository.findByStatementId(previous.getId())).thenReturn(List.of(previousLine));

    var detail = service.create(request("70"), ACTOR_ID);

    var statement = detail.statement();
    assertThat(statement.getPreviousCumulativeHt()).isEqualByComparingTo("4000.00");
    assertThat(statement.getCumulativeAmountHt()).isEqualByComparingTo("7000.00");
    assertThat(statement.getPeriodAmountHt()).isEqualByComparingTo("3000.00");
  }

  @Test
  void create_unknownLot_rejected() {
    when(budgetRepository.findLiveById(budget.getId())).thenReturn(Optional.of(budget));
    when(lotRepository.findLiveByBudgetId(budget.getId())).thenReturn(List.of(lot));
    var request =
        new CreateStatementRequest(
            PROJECT_ID,
            budget.getId(),
            LocalDate.of(2024, 3, 1),
            LocalDate.of(2024, 3, 31),
            null,
            null,
            Map.of(UUID.randomUUID(), new BigDecimal("10")),
            null);

    assertThatThrownBy(() -> service.create(request, ACTOR_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void create_budgetOfAnotherProject_rejected() {
    var foreign =
        withId(new Budget(UUID.randomUUID(), new BigDecimal("10000"), null, null, null, null));
    when(budgetRepository.findLiveById(foreign.getId())).thenReturn(Optional.of(foreign));
    var request =
        new CreateStatementRequest(
            PROJECT_ID,
            foreign.getId(),
            LocalDate.of(2024, 3, 1),
            LocalDate.of(2024, 3, 31),
            null,
            null,
            null,
            null);

    assertThatThrownBy(() -> service.create(request, ACTOR_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void update_changesProgressAndRecomputesTotals() {
    var statement =
        withId(
            new ProgressStatement(
                PROJECT_ID,
                budget.getId(),
                "SIT-2024-002",
                LocalDate.of(2024, 3, 1),
                LocalDate.of(2024, 3, 31),
                new BigDecimal("5"),
                null,
                ACTOR_ID));
    var line =
        new ProgressStatementLine(
            statement.getId(),
            lot.getId(),
            new BigDecimal("10000"),
            new BigDecimal("4000"),
            new BigDecimal("70"));
    when(statementRepository.findLiveById(statement.getId())).thenReturn(Optional.of(statement));
    when(lineRepository.findByStatementId(statement.getId())).thenReturn(List.of(line));
    when(lineRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    when(statementRepository.save(statement)).thenReturn(statement);

    var detail =
        service.update(
            statement.getId(),
            new UpdateStatementRequest(
                null, null, null, null, Map.of(lot.getId(), new BigDecimal("80")), null),
            ACTOR_ID);

    assertThat(detail.statement().getCumulativeAmountHt()).isEqualByComparingTo("8000.00");
    assertThat(detail.statement().getPeriodAmountHt()).isEqualByComparingTo("4000.00");
    assertThat(detail.statement().getPreviousCumulativeHt()).isEqualByComparingTo("4000.00");
  }

  @Test
  void lifecycle_skippingReview_rejected() {
    var statement =
        withId(
            new ProgressStatement(
                PROJECT_ID,
                budget.getId(),
                "SIT-2024-003",
                LocalDate.of(2024, 4, 1),
                LocalDate.of(2024, 4, 30),
                BigDecimal.ZERO,
                null,
                ACTOR_ID));
    when(statementRepository.findLiveById(statement.getId())).thenReturn(Optional.of(statement));

    assertThatThrownBy(() -> service.issue(statement.getId(), ACTOR_ID))
        .isInstanceOf(InvalidTransitionException.class);
    assertThat(statement.getStatus()).isEqualTo(ProgressStatementStatus.DRAFT);
  }

  @Test
  void delete_afterSubmission_rejected() {
    var statement =
        withId(
            new ProgressStatement(
                PROJECT_ID,
                budget.getId(),
                "SIT-2024-004",
                LocalDate.of(2024, 4, 1),
                LocalDate.of(2024, 4, 30),
                BigDecimal.ZERO,
                null,
                ACTOR_ID));
    statement.submitForReview();
    when(statementRepository.findLiveById(statement.getId())).thenReturn(Optional.of(statement));

    assertThatThrownBy(() -> service.delete(statement.getId(), ACTOR_ID))
        .isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void setNotes_afterIssue_rejected() {
    var statement =
        new ProgressStatement(
            PROJECT_ID,
            budget.getId(),
            "SIT-2024-005",
            LocalDate.of(2024, 5, 1),
            LocalDate.of(2024, 5, 31),
            BigDecimal.ZERO,
            null,
            ACTOR_ID);
    statement.setNotes("Draft remark");
    statement.submitForReview();
    statement.issue(ACTOR_ID);

    assertThatThrownBy(() -> statement.setNotes("Late edit"))
        .isInstanceOf(InvalidTransitionException.class);
    assertThat(statement.getNotes()).isEqualTo("Draft remark");
  }
}
