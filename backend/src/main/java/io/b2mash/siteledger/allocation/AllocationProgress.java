package io.b2mash.siteledger.allocation;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One allocation with its physical and financial side by side.
 *
 * @param allocatedAmountHt lot planned amount times the allocated share
 * @param earnedAmountHt allocated amount times the task's physical progress
 */
public record AllocationProgress(
    UUID allocationId,
    UUID taskId,
    String taskTitle,
    String taskStatus,
    BigDecimal taskProgressPct,
    UUID lotId,
    String lotCode,
    String lotLabel,
    BigDecimal lotPlannedAmountHt,
    BigDecimal allocationPct,
    BigDecimal allocatedAmountHt,
    BigDecimal earnedAmountHt) {}
