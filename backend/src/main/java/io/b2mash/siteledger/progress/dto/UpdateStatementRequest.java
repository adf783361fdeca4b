package io.b2mash.siteledger.progress.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/** Partial update of a draft statement. Lots absent from {@code progressByLot} keep their value. */
public record UpdateStatementRequest(
    LocalDate periodStart,
    LocalDate periodEnd,
    BigDecimal retentionPct,
    BigDecimal vatRate,
    Map<UUID, BigDecimal> progressByLot,
    String notes) {}
