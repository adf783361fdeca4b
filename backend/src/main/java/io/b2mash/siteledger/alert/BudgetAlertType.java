package io.b2mash.siteledger.alert;

public enum BudgetAlertType {
  ENGAGED_THRESHOLD("seuil_engage", "engaged"),
  REALIZED_THRESHOLD("seuil_realise", "realized");

  private final String code;
  private final String metric;

  BudgetAlertType(String code, String metric) {
    this.code = code;
    this.metric = metric;
  }

  /** Stable code shared with downstream consumers of alert rows. */
  public String code() {
    return code;
  }

  public String metric() {
    return metric;
  }
}
