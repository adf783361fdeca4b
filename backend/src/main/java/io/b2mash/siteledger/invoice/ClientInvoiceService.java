package io.b2mash.siteledger.invoice;

import io.b2mash.siteledger.audit.AuditAction;
import io.b2mash.siteledger.audit.AuditEventBuilder;
import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.exception.BusinessRuleException;
import io.b2mash.siteledger.exception.InputValidation;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.ResourceConflictException;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.invoice.dto.CreateInvoiceRequest;
import io.b2mash.siteledger.invoice.dto.UpdateInvoiceRequest;
import io.b2mash.siteledger.money.VatRates;
import io.b2mash.siteledger.progress.ProgressStatementRepository;
import io.b2mash.siteledger.progress.ProgressStatementStatus;
import io.b2mash.siteledger.sequence.DocumentNumberService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ClientInvoiceService {

  private static final Logger log = LoggerFactory.getLogger(ClientInvoiceService.class);

  private static final String ENTITY_TYPE = "client_invoice";

  private final ClientInvoiceRepository invoiceRepository;
  private final ProgressStatementRepository statementRepository;
  private final DocumentNumberService documentNumberService;
  private final AuditService auditService;
  private final Clock clock;

  public ClientInvoiceService(
      ClientInvoiceRepository invoiceRepository,
      ProgressStatementRepository statementRepository,
      DocumentNumberService documentNumberService,
      AuditService auditService,
      Clock clock) {
    this.invoiceRepository = invoiceRepository;
    this.statementRepository = statementRepository;
    this.documentNumberService = documentNumberService;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Generates a progress invoice from a client-validated statement, copying its cumulative amount,
   * VAT rate and retention rate.
   *
   * @throws BusinessRuleException if the statement is not client-validated
   * @throws ResourceConflictException if the statement already has an active invoice
   */
  @Transactional
  public ClientInvoice createFromStatement(UUID statementId, UUID actorId) {
    var statement =
        statementRepository
            .findLiveById(statementId)
            .orElseThrow(() -> new ResourceNotFoundException("ProgressStatement", statementId));
    if (statement.getStatus() != ProgressStatementStatus.CLIENT_VALIDATED) {
      throw new BusinessRuleException(
          "statement_not_client_validated",
          "Statement not validated by client",
          "Statement "
              + statement.getNumber()
              + " is "
              + statement.getStatus()
              + "; only client-validated statements can be invoiced");
    }
    if (invoiceRepository.existsActiveByStatementId(statementId)) {
      throw ResourceConflictException.duplicate(
          "Statement already invoiced", "statementId", statementId);
    }

    var invoice =
        new ClientInvoice(
            statement.getProjectId(),
            statementId,
            documentNumberService.nextInvoiceNumber(),
            ClientInvoiceType.PROGRESS,
            statement.getCumulativeAmountHt(),
            statement.getVatRate(),
            statement.getRetentionPct(),
            actorId);
    invoice = invoiceRepository.save(invoice);
    log.info(
        "Created invoice {} ({}) from statement {}: net payable {}",
        invoice.getId(),
        invoice.getNumber(),
        statement.getNumber(),
        invoice.getNetPayable());
    journal(
        invoice, AuditAction.CREATE, "Invoice from statement " + statement.getNumber(), actorId);
    return invoice;
  }

  /** Creates a deposit or final-balance invoice from caller-supplied amounts. */
  @Transactional
  public ClientInvoice createStandalone(CreateInvoiceRequest request, UUID actorId) {
    if (request.type() == ClientInvoiceType.PROGRESS) {
      throw InvalidStateException.forField(
          "type", "Progress invoices are generated from a progress statement");
    }
    InputValidation.requirePositive("amountHt", request.amountHt());
    var invoice =
        new ClientInvoice(
            request.projectId(),
            null,
            documentNumberService.nextInvoiceNumber(),
            request.type(),
            request.amountHt(),
            request.vatRate() != null ? request.vatRate() : VatRates.STANDARD,
            request.retentionPct() != null ? request.retentionPct() : BigDecimal.ZERO,
            actorId);
    invoice.setDueDate(request.dueDate());
    invoice.setNotes(request.notes());
    invoice = invoiceRepository.save(invoice);
    log.info(
        "Created {} invoice {} ({}) for project {}",
        invoice.getType(),
        invoice.getId(),
        invoice.getNumber(),
        invoice.getProjectId());
    journal(invoice, AuditAction.CREATE, invoice.getType() + " invoice created", actorId);
    return invoice;
  }

  @Transactional
  public ClientInvoice update(UUID invoiceId, UpdateInvoiceRequest request, UUID actorId) {
    var invoice = get(invoiceId);
    invoice.updateDraft(
        request.amountHt(),
        request.vatRate(),
        request.retentionPct(),
        request.dueDate(),
        request.notes());
    invoice = invoiceRepository.save(invoice);
    log.info("Updated invoice {}", invoiceId);
    journal(invoice, AuditAction.UPDATE, "Invoice updated", actorId);
    return invoice;
  }

  @Transactional
  public ClientInvoice issue(UUID invoiceId, UUID actorId) {
    var invoice = get(invoiceId);
    invoice.issue(LocalDate.now(clock));
    invoice = invoiceRepository.save(invoice);
    log.info("Issued invoice {}", invoice.getNumber());
    journal(invoice, AuditAction.ISSUE, "Invoice issued", actorId);
    return invoice;
  }

  @Transactional
  public ClientInvoice send(UUID invoiceId, UUID actorId) {
    var invoice = get(invoiceId);
    invoice.send();
    invoice = invoiceRepository.save(invoice);
    log.info("Sent invoice {}", invoice.getNumber());
    journal(invoice, AuditAction.UPDATE, "Invoice sent", actorId);
    return invoice;
  }

  /** Marks the invoice paid and moves its originating statement to INVOICED when still pending. */
  @Transactional
  public ClientInvoice markPaid(UUID invoiceId, UUID actorId) {
    var invoice = get(invoiceId);
    invoice.markPaid();
    invoice = invoiceRepository.save(invoice);
    log.info("Invoice {} paid", invoice.getNumber());
    advanceStatement(invoice);
    journal(invoice, AuditAction.UPDATE, "Invoice paid", actorId);
    return invoice;
  }

  @Transactional
  public ClientInvoice cancel(UUID invoiceId, UUID actorId) {
    var invoice = get(invoiceId);
    invoice.cancel();
    invoice = invoiceRepository.save(invoice);
    log.info("Cancelled invoice {}", invoice.getNumber());
    journal(invoice, AuditAction.UPDATE, "Invoice cancelled", actorId);
    return invoice;
  }

  @Transactional
  public void delete(UUID invoiceId, UUID actorId) {
    var invoice = get(invoiceId);
    invoice.softDelete(actorId);
    invoiceRepository.save(invoice);
    log.info("Soft-deleted invoice {}", invoiceId);
    journal(invoice, AuditAction.DELETE, "Invoice deleted", actorId);
  }

  /**
   * Entry point for external reconciliation: adds a collected amount. Reaching the net payable on
   * a sent invoice marks it paid, with the same statement side effect as {@link #markPaid}.
   */
  @Transactional
  public ClientInvoice recordCollection(UUID invoiceId, BigDecimal amount, LocalDate date) {
    var invoice = get(invoiceId);
    boolean paid = invoice.recordCollection(amount, date);
    invoice = invoiceRepository.save(invoice);
    log.info(
        "Recorded collection of {} on invoice {} (total collected {})",
        amount,
        invoice.getNumber(),
        invoice.getCollectedAmount());
    if (paid) {
      log.info("Invoice {} fully collected, marked paid", invoice.getNumber());
      advanceStatement(invoice);
    }
    var details = new HashMap<String, Object>();
    details.put("amount", amount.toPlainString());
    details.put("collected_amount", invoice.getCollectedAmount().toPlainString());
    details.put("paid", paid);
    auditService.log(
        AuditEventBuilder.builder()
            .entityType(ENTITY_TYPE)
            .entityId(invoice.getId())
            .projectId(invoice.getProjectId())
            .action(AuditAction.UPDATE)
            .detail("Collection recorded")
            .details(details)
            .build());
    return invoice;
  }

  @Transactional(readOnly = true)
  public ClientInvoice get(UUID invoiceId) {
    return invoiceRepository
        .findLiveById(invoiceId)
        .orElseThrow(() -> new ResourceNotFoundException("ClientInvoice", invoiceId));
  }

  @Transactional(readOnly = true)
  public List<ClientInvoice> listByProject(UUID projectId) {
    return invoiceRepository.findLiveByProjectId(projectId);
  }

  private void advanceStatement(ClientInvoice invoice) {
    if (invoice.getStatementId() == null) {
      return;
    }
    statementRepository
        .findLiveById(invoice.getStatementId())
        .filter(statement -> statement.getStatus() == ProgressStatementStatus.CLIENT_VALIDATED)
        .ifPresent(
            statement -> {
              statement.markInvoiced(null);
              statementRepository.save(statement);
              log.info(
                  "Statement {} marked invoiced by payment of {}",
                  statement.getNumber(),
                  invoice.getNumber());
            });
  }

  private void journal(ClientInvoice invoice, AuditAction action, String detail, UUID actorId) {
    auditService.log(
        AuditEventBuilder.builder()
            .entityType(ENTITY_TYPE)
            .entityId(invoice.getId())
            .projectId(invoice.getProjectId())
            .action(action)
            .detail(detail)
            .actorId(actorId)
            .details(
                Map.of(
                    "number", String.valueOf(invoice.getNumber()),
                    "status", invoice.getStatus().name(),
                    "net_payable", invoice.getNetPayable().toPlainString()))
            .build());
  }
}
