package io.b2mash.siteledger.sequence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.UUID;

/**
 * Counter row for one {@code (kind, scope, year)}. Only written through the atomic upsert in
 * {@link DocumentNumberService}.
 */
@Entity
@Table(
    name = "document_counters",
    uniqueConstraints = @UniqueConstraint(columnNames = {"kind", "scope_id", "year"}))
public class DocumentCounter {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 30)
  private DocumentKind kind;

  @Column(name = "scope_id", nullable = false)
  private UUID scopeId;

  @Column(name = "year", nullable = false)
  private int year;

  @Column(name = "next_value", nullable = false)
  private int nextValue = 1;

  protected DocumentCounter() {}

  public UUID getId() {
    return id;
  }

  public DocumentKind getKind() {
    return kind;
  }

  public UUID getScopeId() {
    return scopeId;
  }

  public int getYear() {
    return year;
  }

  public int getNextValue() {
    return nextValue;
  }
}
