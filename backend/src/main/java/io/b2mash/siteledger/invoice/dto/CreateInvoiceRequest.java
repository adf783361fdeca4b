package io.b2mash.siteledger.invoice.dto;

import io.b2mash.siteledger.invoice.ClientInvoiceType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Standalone invoice (deposit or final balance).
 *
 * @param vatRate defaults to 20 when null
 * @param retentionPct defaults to 0 when null
 */
public record CreateInvoiceRequest(
    @NotNull UUID projectId,
    @NotNull ClientInvoiceType type,
    @NotNull @Positive BigDecimal amountHt,
    BigDecimal vatRate,
    BigDecimal retentionPct,
    LocalDate dueDate,
    String notes) {}
