package io.b2mash.siteledger.lot;

import static io.b2mash.siteledger.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.budget.Budget;
import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.exception.BusinessRuleException;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.ResourceConflictException;
import io.b2mash.siteledger.lot.dto.LotRequest;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BudgetLotServiceTest {

  private static final UUID ACTOR_ID = UUID.randomUUID();

  @Mock private BudgetLotRepository lotRepository;
  @Mock private BudgetRepository budgetRepository;
  @Mock private AuditService auditService;

  private BudgetLotService service;
  private Budget budget;

  @BeforeEach
  void setUp() {
    service = new BudgetLotService(lotRepository, budgetRepository, auditService);
    budget =
        withId(new Budget(UUID.randomUUID(), new BigDecimal("100000"), null, null, null, null));
  }

  private static LotRequest siteLot(UUID budgetId, UUID parentId, String code) {
    return new LotRequest(
        budgetId,
        null,
        parentId,
        code,
        "Earthworks",
        "m3",
        new BigDecimal("200"),
        new BigDecimal("35"),
        null,
        null,
        null);
  }

  private BudgetLot lot(String code, String quantity, String price) {
    return withId(
        new BudgetLot(
            budget.getId(), null, code, code, new BigDecimal(quantity), new BigDecimal(price)));
  }

  @Test
  void create_siteLot_saved() {
    when(budgetRepository.findLiveById(budget.getId())).thenReturn(Optional.of(budget));
    when(lotRepository.existsLiveByOwnerAndCode(budget.getId(), "L01")).thenReturn(false);
    when(lotRepository.save(any(BudgetLot.class)))
        .thenAnswer(invocation -> withId(invocation.getArgument(0)));

    var lot = service.create(siteLot(budget.getId(), null, "L01"), ACTOR_ID);

    assertThat(lot.getPlannedTotalHt()).isEqualByComparingTo("7000.00");
    assertThat(lot.getUnit()).isEqualTo("m3");
    assertThat(lot.getBudgetId()).isEqualTo(budget.getId());
  }

  @Test
  void create_duplicateCode_conflict() {
    when(budgetRepository.findLiveById(budget.getId())).thenReturn(Optional.of(budget));
    when(lotRepository.existsLiveByOwnerAndCode(budget.getId(), "L01")).thenReturn(true);

    assertThatThrownBy(() -> service.create(siteLot(budget.getId(), null, "L01"), ACTOR_ID))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void create_parentOfOtherBudget_rejected() {
    var foreignParent =
        withId(
            new BudgetLot(UUID.randomUUID(), null, "P01", "Other", BigDecimal.ONE, BigDecimal.ONE));
    when(budgetRepository.findLiveById(budget.getId())).thenReturn(Optional.of(budget));
    when(lotRepository.existsLiveByOwnerAndCode(budget.getId(), "L02")).thenReturn(false);
    when(lotRepository.findLiveById(foreignParent.getId())).thenReturn(Optional.of(foreignParent));

    assertThatThrownBy(
            () -> service.create(siteLot(budget.getId(), foreignParent.getId(), "L02"), ACTOR_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void update_parentIsDescendant_rejected() {
    var root = lot("L01", "1", "100");
    var child = lot("L01.1", "1", "50");
    child.setParentLotId(root.getId());
    when(lotRepository.findLiveById(root.getId())).thenReturn(Optional.of(root));
    when(lotRepository.findLiveById(child.getId())).thenReturn(Optional.of(child));

    var request =
        new LotRequest(
            null, null, child.getId(), null, null, null, null, null, null, null, null);

    assertThatThrownBy(() -> service.update(root.getId(), request, ACTOR_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void delete_withLiveChildren_rejected() {
    var root = lot("L01", "1", "100");
    when(lotRepository.findLiveById(root.getId())).thenReturn(Optional.of(root));
    when(lotRepository.hasLiveChildren(root.getId())).thenReturn(true);

    assertThatThrownBy(() -> service.delete(root.getId(), ACTOR_ID))
        .isInstanceOf(BusinessRuleException.class);
  }

  @Test
  void tree_rollsUpChildrenAndPromotesOrphans() {
    var root = lot("L01", "1", "1000");
    var child = lot("L01.1", "2", "100");
    child.setParentLotId(root.getId());
    var grandChild = lot("L01.1.1", "1", "50");
    grandChild.setParentLotId(child.getId());
    var orphan = lot("L09", "1", "10");
    orphan.setParentLotId(UUID.randomUUID());
    when(lotRepository.findLiveByBudgetId(budget.getId()))
        .thenReturn(List.of(root, child, grandChild, orphan));

    var tree = service.tree(budget.getId());

    assertThat(tree).hasSize(2);
    assertThat(tree.get(0).code()).isEqualTo("L01");
    assertThat(tree.get(0).rolledUpTotalHt()).isEqualByComparingTo("1250.00");
    assertThat(tree.get(0).children()).hasSize(1);
    assertThat(tree.get(0).children().get(0).rolledUpTotalHt()).isEqualByComparingTo("250.00");
    assertThat(tree.get(1).code()).isEqualTo("L09");
  }
}
