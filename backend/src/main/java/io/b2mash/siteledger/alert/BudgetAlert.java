package io.b2mash.siteledger.alert;

import io.b2mash.siteledger.exception.InvalidTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A budget threshold breach observed by one detection run. Rows are a historical trail: each run
 * that finds a breach appends a new row. Acknowledgement is one-way.
 */
@Entity
@Table(name = "budget_alerts")
public class BudgetAlert {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "budget_id", nullable = false)
  private UUID budgetId;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 30)
  private BudgetAlertType type;

  @Column(name = "message", nullable = false, columnDefinition = "TEXT")
  private String message;

  @Column(name = "reached_pct", nullable = false, precision = 7, scale = 2)
  private BigDecimal reachedPct;

  @Column(name = "threshold_pct", nullable = false, precision = 5, scale = 2)
  private BigDecimal thresholdPct;

  @Column(name = "budget_amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal budgetAmountHt;

  @Column(name = "reached_amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal reachedAmountHt;

  @Column(name = "acknowledged", nullable = false)
  private boolean acknowledged;

  @Column(name = "acknowledged_by")
  private UUID acknowledgedBy;

  @Column(name = "acknowledged_at")
  private Instant acknowledgedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected BudgetAlert() {}

  public BudgetAlert(
      UUID projectId,
      UUID budgetId,
      BudgetAlertType type,
      String message,
      BigDecimal reachedPct,
      BigDecimal thresholdPct,
      BigDecimal budgetAmountHt,
      BigDecimal reachedAmountHt) {
    this.projectId = projectId;
    this.budgetId = budgetId;
    this.type = type;
    this.message = message;
    this.reachedPct = reachedPct;
    this.thresholdPct = thresholdPct;
    this.budgetAmountHt = budgetAmountHt;
    this.reachedAmountHt = reachedAmountHt;
    this.acknowledged = false;
    this.createdAt = Instant.now();
  }

  public void acknowledge(UUID actorId) {
    if (acknowledged) {
      throw new InvalidTransitionException("BudgetAlert", id, "acknowledged", "acknowledged");
    }
    this.acknowledged = true;
    this.acknowledgedBy = actorId;
    this.acknowledgedAt = Instant.now();
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getBudgetId() {
    return budgetId;
  }

  public BudgetAlertType getType() {
    return type;
  }

  public String getMessage() {
    return message;
  }

  public BigDecimal getReachedPct() {
    return reachedPct;
  }

  public BigDecimal getThresholdPct() {
    return thresholdPct;
  }

  public BigDecimal getBudgetAmountHt() {
    return budgetAmountHt;
  }

  public BigDecimal getReachedAmountHt() {
    return reachedAmountHt;
  }

  public boolean isAcknowledged() {
    return acknowledged;
  }

  public UUID getAcknowledgedBy() {
    return acknowledgedBy;
  }

  public Instant getAcknowledgedAt() {
    return acknowledgedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
