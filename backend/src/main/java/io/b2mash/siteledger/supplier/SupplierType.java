package io.b2mash.siteledger.supplier;

public enum SupplierType {
  MATERIALS_TRADER,
  EQUIPMENT_RENTAL,
  /** Invoices under reverse-charge VAT: every purchase order against it carries VAT 0. */
  SUBCONTRACTOR,
  SERVICE
}
