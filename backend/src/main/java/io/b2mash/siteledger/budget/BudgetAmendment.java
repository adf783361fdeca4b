package io.b2mash.siteledger.budget;

import io.b2mash.siteledger.exception.InputValidation;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.InvalidTransitionException;
import io.b2mash.siteledger.money.MonetaryCalculator;
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

/** Signed change order on a budget envelope. Only DRAFT amendments may be edited or deleted. */
@Entity
@Table(name = "budget_amendments")
public class BudgetAmendment {

  private static final String ENTITY = "BudgetAmendment";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "budget_id", nullable = false)
  private UUID budgetId;

  @Column(name = "number", nullable = false, length = 20)
  private String number;

  @Column(name = "reason", nullable = false, columnDefinition = "TEXT")
  private String reason;

  @Column(name = "amount_ht", nullable = false, precision = 14, scale = 2)
  private BigDecimal amountHt;

  @Column(name = "impact_description", columnDefinition = "TEXT")
  private String impactDescription;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private AmendmentStatus status;

  @Column(name = "validated_by")
  private UUID validatedBy;

  @Column(name = "validated_at")
  private Instant validatedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "deleted_by")
  private UUID deletedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BudgetAmendment() {}

  public BudgetAmendment(
      UUID budgetId, String number, String reason, BigDecimal amountHt, String impactDescription) {
    this.budgetId = InputValidation.requirePresent("budgetId", budgetId);
    this.number = number;
    this.reason = InputValidation.requireText("reason", reason);
    this.amountHt = requireNonZero(amountHt);
    this.impactDescription = impactDescription;
    this.status = AmendmentStatus.DRAFT;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(String reason, BigDecimal amountHt, String impactDescription) {
    requireDraft("update");
    if (reason != null) {
      this.reason = InputValidation.requireText("reason", reason);
    }
    if (amountHt != null) {
      this.amountHt = requireNonZero(amountHt);
    }
    if (impactDescription != null) {
      this.impactDescription = impactDescription;
    }
    this.updatedAt = Instant.now();
  }

  public void validate(UUID validatorId) {
    if (!status.canTransitionTo(AmendmentStatus.VALIDATED)) {
      throw new InvalidTransitionException(ENTITY, id, status, AmendmentStatus.VALIDATED);
    }
    this.status = AmendmentStatus.VALIDATED;
    this.validatedBy = validatorId;
    this.validatedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void softDelete(UUID actorId) {
    requireDraft("delete");
    this.deletedAt = Instant.now();
    this.deletedBy = actorId;
    this.updatedAt = Instant.now();
  }

  public boolean isValidated() {
    return status == AmendmentStatus.VALIDATED;
  }

  private void requireDraft(String operation) {
    if (status != AmendmentStatus.DRAFT) {
      throw InvalidTransitionException.forOperation(ENTITY, id, status, operation);
    }
  }

  private static BigDecimal requireNonZero(BigDecimal amountHt) {
    if (amountHt == null || amountHt.signum() == 0) {
      throw InvalidStateException.forField("amountHt", "Amendment amount must be non-zero");
    }
    return MonetaryCalculator.roundAmount(amountHt);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getBudgetId() {
    return budgetId;
  }

  public String getNumber() {
    return number;
  }

  public String getReason() {
    return reason;
  }

  public BigDecimal getAmountHt() {
    return amountHt;
  }

  public String getImpactDescription() {
    return impactDescription;
  }

  public AmendmentStatus getStatus() {
    return status;
  }

  public UUID getValidatedBy() {
    return validatedBy;
  }

  public Instant getValidatedAt() {
    return validatedAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
