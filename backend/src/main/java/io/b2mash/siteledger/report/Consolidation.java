package io.b2mash.siteledger.report;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.math.BigDecimal;
import java.util.List;

public record Consolidation(
    List<ConsolidatedProject> projects,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalRevisedBudgetHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalEngagedHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalRealizedHt,
    long totalOpenAlerts) {}
