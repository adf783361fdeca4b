package io.b2mash.siteledger.invoice;

public enum ClientInvoiceType {
  /** Advance payment, created standalone. */
  DEPOSIT,
  /** Generated from a client-validated progress statement. */
  PROGRESS,
  /** Closing balance, created standalone. */
  FINAL
}
