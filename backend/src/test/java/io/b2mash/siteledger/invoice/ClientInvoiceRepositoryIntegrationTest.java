package io.b2mash.siteledger.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.siteledger.TestcontainersConfiguration;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

/** Checks the one-active-invoice-per-statement rule at the database level. */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
class ClientInvoiceRepositoryIntegrationTest {

  private static final UUID ACTOR_ID = UUID.randomUUID();

  @Autowired private ClientInvoiceRepository clientInvoiceRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  private UUID projectId;
  private UUID statementId;

  @BeforeEach
  void setUp() {
    projectId = UUID.randomUUID();
    var budgetId = UUID.randomUUID();
    statementId = UUID.randomUUID();
    jdbcTemplate.update(
        "INSERT INTO budgets (id, project_id, initial_amount_ht) VALUES (?, ?, 100000)",
        budgetId,
        projectId);
    jdbcTemplate.update(
        "INSERT INTO progress_statements"
            + " (id, project_id, budget_id, number, period_start, period_end, retention_pct,"
            + " vat_rate, status)"
            + " VALUES (?, ?, ?, 'SIT-2025-01', DATE '2025-03-01', DATE '2025-03-31', 5, 20,"
            + " 'CLIENT_VALIDATED')",
        statementId,
        projectId,
        budgetId);
  }

  private ClientInvoice progressInvoice() {
    return new ClientInvoice(
        projectId,
        statementId,
        "FAC-IT-" + UUID.randomUUID().toString().substring(0, 8),
        ClientInvoiceType.PROGRESS,
        new BigDecimal("12000.00"),
        new BigDecimal("20"),
        new BigDecimal("5"),
        ACTOR_ID);
  }

  @Test
  void secondActiveInvoiceForStatement_rejectedByDatabase() {
    clientInvoiceRepository.saveAndFlush(progressInvoice());

    assertThat(clientInvoiceRepository.existsActiveByStatementId(statementId)).isTrue();
    assertThatThrownBy(() -> clientInvoiceRepository.saveAndFlush(progressInvoice()))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void cancelledInvoice_releasesStatement() {
    var first = progressInvoice();
    first.cancel();
    clientInvoiceRepository.saveAndFlush(first);

    assertThat(clientInvoiceRepository.existsActiveByStatementId(statementId)).isFalse();

    clientInvoiceRepository.saveAndFlush(progressInvoice());

    assertThat(clientInvoiceRepository.existsActiveByStatementId(statementId)).isTrue();
  }

  @Test
  void deletedInvoice_releasesStatement() {
    var first = progressInvoice();
    first.softDelete(ACTOR_ID);
    clientInvoiceRepository.saveAndFlush(first);

    assertThat(clientInvoiceRepository.existsActiveByStatementId(statementId)).isFalse();
  }
}
