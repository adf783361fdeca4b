package io.b2mash.siteledger.progress.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.siteledger.progress.ProgressStatementLine;
import java.math.BigDecimal;
import java.util.UUID;

public record StatementLineResponse(
    UUID id,
    UUID lotId,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal progressPct,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal contractAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal previousCumulativeHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal cumulativeAmountHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal periodAmountHt) {

  public static StatementLineResponse from(ProgressStatementLine line) {
    return new StatementLineResponse(
        line.getId(),
        line.getLotId(),
        line.getProgressPct(),
        line.getContractAmountHt(),
        line.getPreviousCumulativeHt(),
        line.getCumulativeAmountHt(),
        line.getPeriodAmountHt());
  }
}
