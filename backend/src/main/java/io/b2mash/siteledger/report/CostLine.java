package io.b2mash.siteledger.report;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.math.BigDecimal;

public record CostLine(
    CostCategory category,
    String label,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal amountHt) {

  public enum CostCategory {
    PURCHASES,
    LABOR,
    EQUIPMENT
  }
}
