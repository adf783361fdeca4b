package io.b2mash.siteledger.alert;

import io.b2mash.siteledger.event.BudgetThresholdReachedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Reports committed threshold breaches. Runs after commit so a rolled-back detection run never
 * surfaces an alert.
 */
@Component
public class BudgetAlertEventListener {

  private static final Logger log = LoggerFactory.getLogger(BudgetAlertEventListener.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onThresholdReached(BudgetThresholdReachedEvent event) {
    log.warn(
        "Budget alert {} for project {}: {} at {}% of {} HT (threshold {}%)",
        event.alertId(),
        event.projectId(),
        event.alertType(),
        event.reachedPct(),
        event.budgetAmountHt(),
        event.thresholdPct());
  }
}
