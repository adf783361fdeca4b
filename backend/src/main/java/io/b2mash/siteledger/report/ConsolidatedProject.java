package io.b2mash.siteledger.report;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.math.BigDecimal;
import java.util.UUID;

public record ConsolidatedProject(
    UUID projectId,
    String name,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal revisedBudgetHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal engagedHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal realizedHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal engagedPct,
    long openAlerts) {}
