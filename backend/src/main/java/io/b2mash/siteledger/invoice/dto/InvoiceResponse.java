package io.b2mash.siteledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.siteledger.invoice.ClientInvoice;
import io.b2mash.siteledger.invoice.ClientInvoiceStatus;
import io.b2mash.siteledger.invoice.ClientInvoiceType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record InvoiceResponse(
    UUID id,
    UUID projectId,
    UUID statementId,
    String number,
    ClientInvoiceType type,
    ClientInvoiceStatus status,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal amountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal vatRate,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal vatAmount,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalTtc,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal retentionPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal retentionAmount,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal netPayable,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal collectedAmount,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal outstandingAmount,
    LocalDate issueDate,
    LocalDate dueDate,
    LocalDate collectionDate,
    String notes) {

  public static InvoiceResponse from(ClientInvoice invoice) {
    return new InvoiceResponse(
        invoice.getId(),
        invoice.getProjectId(),
        invoice.getStatementId(),
        invoice.getNumber(),
        invoice.getType(),
        invoice.getStatus(),
        invoice.getAmountHt(),
        invoice.getVatRate(),
        invoice.getVatAmount(),
        invoice.getTotalTtc(),
        invoice.getRetentionPct(),
        invoice.getRetentionAmount(),
        invoice.getNetPayable(),
        invoice.getCollectedAmount(),
        invoice.getOutstandingAmount(),
        invoice.getIssueDate(),
        invoice.getDueDate(),
        invoice.getCollectionDate(),
        invoice.getNotes());
  }
}
