package io.b2mash.siteledger.progress.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.siteledger.progress.ProgressStatementStatus;
import io.b2mash.siteledger.progress.StatementDetail;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record StatementResponse(
    UUID id,
    UUID projectId,
    UUID budgetId,
    String number,
    LocalDate periodStart,
    LocalDate periodEnd,
    ProgressStatementStatus status,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal retentionPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal vatRate,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal previousCumulativeHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal periodAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal cumulativeAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal retentionAmount,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal vatAmount,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalTtc,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal netPayable,
    String notes,
    UUID validatedBy,
    Instant validatedAt,
    Instant invoicedAt,
    List<StatementLineResponse> lines) {

  public static StatementResponse from(StatementDetail detail) {
    var statement = detail.statement();
    return new StatementResponse(
        statement.getId(),
        statement.getProjectId(),
        statement.getBudgetId(),
        statement.getNumber(),
        statement.getPeriodStart(),
        statement.getPeriodEnd(),
        statement.getStatus(),
        statement.getRetentionPct(),
        statement.getVatRate(),
        statement.getPreviousCumulativeHt(),
        statement.getPeriodAmountHt(),
        statement.getCumulativeAmountHt(),
        statement.getRetentionAmount(),
        statement.getVatAmount(),
        statement.getTotalTtc(),
        statement.getNetPayable(),
        statement.getNotes(),
        statement.getValidatedBy(),
        statement.getValidatedAt(),
        statement.getInvoicedAt(),
        detail.lines().stream().map(StatementLineResponse::from).toList());
  }
}
