package io.b2mash.siteledger.report;

import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.invoice.ClientInvoiceRepository;
import io.b2mash.siteledger.invoice.ClientInvoiceStatus;
import io.b2mash.siteledger.money.MonetaryCalculator;
import io.b2mash.siteledger.project.ProjectInfo;
import io.b2mash.siteledger.project.ProjectInfoProvider;
import io.b2mash.siteledger.purchase.PurchaseAggregationService;
import io.b2mash.siteledger.report.CostLine.CostCategory;
import io.b2mash.siteledger.sitecost.SiteCostReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Project P&L: billed revenue against realized purchases, labor and internal equipment, with a
 * general overhead share applied on direct costs. Recomputed on every call.
 */
@Service
public class ProjectPnlService {

  private static final Logger log = LoggerFactory.getLogger(ProjectPnlService.class);

  private final BudgetRepository budgetRepository;
  private final ClientInvoiceRepository invoiceRepository;
  private final PurchaseAggregationService aggregationService;
  private final SiteCostReader siteCostReader;
  private final ProjectInfoProvider projectInfoProvider;
  private final PnlProperties pnlProperties;

  public ProjectPnlService(
      BudgetRepository budgetRepository,
      ClientInvoiceRepository invoiceRepository,
      PurchaseAggregationService aggregationService,
      SiteCostReader siteCostReader,
      ProjectInfoProvider projectInfoProvider,
      PnlProperties pnlProperties) {
    this.budgetRepository = budgetRepository;
    this.invoiceRepository = invoiceRepository;
    this.aggregationService = aggregationService;
    this.siteCostReader = siteCostReader;
    this.projectInfoProvider = projectInfoProvider;
    this.pnlProperties = pnlProperties;
  }

  @Transactional(readOnly = true)
  public ProjectPnl compute(UUID projectId) {
    var budget =
        budgetRepository
            .findLiveByProjectId(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Budget", projectId));

    var revenue =
        MonetaryCalculator.roundAmount(
            invoiceRepository.sumAmountByProjectAndStatuses(
                projectId, ClientInvoiceStatus.BILLED));
    var purchases = MonetaryCalculator.roundAmount(aggregationService.realizedAmount(projectId));
    var labor = MonetaryCalculator.roundAmount(siteCostReader.laborCost(projectId));
    var equipment = MonetaryCalculator.roundAmount(siteCostReader.internalEquipmentCost(projectId));
    var totalCosts = purchases.add(labor).add(equipment);

    var overhead =
        MonetaryCalculator.overheadShare(totalCosts, pnlProperties.overheadCoefficientPct());
    var grossMargin = revenue.subtract(totalCosts).subtract(overhead);
    var marginPct = MonetaryCalculator.marginPct(revenue, totalCosts, overhead);

    var pnl =
        new ProjectPnl(
            projectId,
            revenue,
            purchases,
            labor,
            equipment,
            totalCosts,
            overhead,
            grossMargin,
            marginPct != null ? marginPct : BigDecimal.ZERO.setScale(MonetaryCalculator.SCALE),
            budget.getInitialAmountHt(),
            budget.getRevisedAmountHt(),
            costLines(purchases, labor, equipment),
            isClosed(projectId));
    log.debug(
        "P&L for project {}: revenue={}, costs={}, overhead={}, margin={}",
        projectId,
        revenue,
        totalCosts,
        overhead,
        grossMargin);
    return pnl;
  }

  private static List<CostLine> costLines(
      BigDecimal purchases, BigDecimal labor, BigDecimal equipment) {
    var lines = new ArrayList<CostLine>();
    if (purchases.signum() != 0) {
      lines.add(new CostLine(CostCategory.PURCHASES, "Invoiced purchases", purchases));
    }
    if (labor.signum() != 0) {
      lines.add(new CostLine(CostCategory.LABOR, "Labor", labor));
    }
    if (equipment.signum() != 0) {
      lines.add(new CostLine(CostCategory.EQUIPMENT, "Internal equipment", equipment));
    }
    return List.copyOf(lines);
  }

  private boolean isClosed(UUID projectId) {
    try {
      return projectInfoProvider.find(projectId).map(ProjectInfo::isClosed).orElse(false);
    } catch (RuntimeException e) {
      log.warn(
          "Project info unavailable for {}, reporting P&L as provisional: {}",
          projectId,
          e.getMessage());
      return false;
    }
  }
}
