package io.b2mash.siteledger.supplier;

import io.b2mash.siteledger.exception.InputValidation;
import io.b2mash.siteledger.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "suppliers")
public class Supplier {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 30)
  private SupplierType type;

  /** SIRET, 14 digits. */
  @Column(name = "tax_id", length = 14)
  private String taxId;

  @Column(name = "contact_name", length = 255)
  private String contactName;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "phone", length = 30)
  private String phone;

  @Column(name = "active", nullable = false)
  private boolean active = true;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "deleted_by")
  private UUID deletedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Supplier() {}

  public Supplier(String name, SupplierType type, String taxId) {
    this.name = InputValidation.requireText("name", name);
    this.type = InputValidation.requirePresent("type", type);
    this.taxId = normalizeTaxId(taxId);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateDetails(
      String name, SupplierType type, String taxId, String contactName, String email, String phone) {
    this.name = InputValidation.requireText("name", name);
    this.type = InputValidation.requirePresent("type", type);
    this.taxId = normalizeTaxId(taxId);
    this.contactName = contactName;
    this.email = email;
    this.phone = phone;
    this.updatedAt = Instant.now();
  }

  public void setContact(String contactName, String email, String phone) {
    this.contactName = contactName;
    this.email = email;
    this.phone = phone;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public void activate() {
    this.active = true;
    this.updatedAt = Instant.now();
  }

  public void softDelete(UUID actorId) {
    this.deletedAt = Instant.now();
    this.deletedBy = actorId;
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public boolean isSubcontractor() {
    return type == SupplierType.SUBCONTRACTOR;
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  static String normalizeTaxId(String taxId) {
    if (taxId == null || taxId.isBlank()) {
      return null;
    }
    String digits = taxId.replace(" ", "");
    if (!digits.matches("\\d{14}")) {
      throw InvalidStateException.forField("taxId", "SIRET must be 14 digits, got " + taxId);
    }
    return digits;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public SupplierType getType() {
    return type;
  }

  public String getTaxId() {
    return taxId;
  }

  public String getContactName() {
    return contactName;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public UUID getDeletedBy() {
    return deletedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
