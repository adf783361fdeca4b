package io.b2mash.siteledger.report;

import io.b2mash.siteledger.alert.BudgetAlertService;
import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.money.MonetaryCalculator;
import io.b2mash.siteledger.project.ProjectInfo;
import io.b2mash.siteledger.project.ProjectInfoProvider;
import io.b2mash.siteledger.purchase.PurchaseAggregationService;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Portfolio view across several projects. Projects without a budget are skipped. */
@Service
public class ConsolidationService {

  private static final Logger log = LoggerFactory.getLogger(ConsolidationService.class);

  private final BudgetRepository budgetRepository;
  private final PurchaseAggregationService aggregationService;
  private final BudgetAlertService alertService;
  private final ProjectInfoProvider projectInfoProvider;

  public ConsolidationService(
      BudgetRepository budgetRepository,
      PurchaseAggregationService aggregationService,
      BudgetAlertService alertService,
      ProjectInfoProvider projectInfoProvider) {
    this.budgetRepository = budgetRepository;
    this.aggregationService = aggregationService;
    this.alertService = alertService;
    this.projectInfoProvider = projectInfoProvider;
  }

  @Transactional(readOnly = true)
  public Consolidation consolidate(Collection<UUID> projectIds) {
    var rows = new ArrayList<ConsolidatedProject>();
    var totalRevised = BigDecimal.ZERO;
    var totalEngaged = BigDecimal.ZERO;
    var totalRealized = BigDecimal.ZERO;
    long totalAlerts = 0;

    for (var projectId : projectIds) {
      var budgetOpt = budgetRepository.findLiveByProjectId(projectId);
      if (budgetOpt.isEmpty()) {
        log.debug("Project {} has no budget, left out of consolidation", projectId);
        continue;
      }
      var revised = budgetOpt.get().getRevisedAmountHt();
      var engaged = aggregationService.engagedAmount(projectId);
      var realized = aggregationService.realizedAmount(projectId);
      long alerts = alertService.countUnacknowledged(projectId);

      rows.add(
          new ConsolidatedProject(
              projectId,
              displayName(projectId),
              revised,
              engaged,
              realized,
              MonetaryCalculator.percentOf(engaged, revised),
              alerts));
      totalRevised = totalRevised.add(revised);
      totalEngaged = totalEngaged.add(engaged);
      totalRealized = totalRealized.add(realized);
      totalAlerts += alerts;
    }

    log.info("Consolidated {} of {} project(s)", rows.size(), projectIds.size());
    return new Consolidation(
        rows,
        MonetaryCalculator.roundAmount(totalRevised),
        MonetaryCalculator.roundAmount(totalEngaged),
        MonetaryCalculator.roundAmount(totalRealized),
        totalAlerts);
  }

  private String displayName(UUID projectId) {
    try {
      return projectInfoProvider
          .find(projectId)
          .map(ProjectInfo::name)
          .orElse("Project " + projectId);
    } catch (RuntimeException e) {
      log.warn("Project info unavailable for {}: {}", projectId, e.getMessage());
      return "Project " + projectId;
    }
  }
}
