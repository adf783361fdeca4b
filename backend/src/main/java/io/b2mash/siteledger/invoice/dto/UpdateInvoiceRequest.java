package io.b2mash.siteledger.invoice.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record UpdateInvoiceRequest(
    BigDecimal amountHt,
    BigDecimal vatRate,
    BigDecimal retentionPct,
    LocalDate dueDate,
    String notes) {}
