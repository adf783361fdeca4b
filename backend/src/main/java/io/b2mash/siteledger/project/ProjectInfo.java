package io.b2mash.siteledger.project;

/** Display name and lifecycle status of a construction project, owned outside the ledger. */
public record ProjectInfo(String name, String status) {

  public static final String CLOSED = "CLOSED";

  public boolean isClosed() {
    return CLOSED.equalsIgnoreCase(status);
  }
}
