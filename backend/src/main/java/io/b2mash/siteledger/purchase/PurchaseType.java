package io.b2mash.siteledger.purchase;

public enum PurchaseType {
  MATERIAL,
  EQUIPMENT,
  /** Reverse-charge VAT applies: always carries a 0% rate. */
  SUBCONTRACTING,
  SERVICE,
  LABOR
}
