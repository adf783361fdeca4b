package io.b2mash.siteledger.report;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Profit and loss of one project.
 *
 * @param grossMarginPct zero when nothing has been billed yet
 * @param finalReport true once the project is closed and the figures can no longer move
 */
public record ProjectPnl(
    UUID projectId,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal revenueHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal purchaseCostHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal laborCostHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal equipmentCostHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalCostsHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal overheadHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal grossMarginHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal grossMarginPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal initialBudgetHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal revisedBudgetHt,
    List<CostLine> costLines,
    boolean finalReport) {}
