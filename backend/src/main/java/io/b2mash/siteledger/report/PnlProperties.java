package io.b2mash.siteledger.report;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param overheadCoefficientPct general overhead charged on top of a project's direct costs
 */
@ConfigurationProperties(prefix = "siteledger.pnl")
public record PnlProperties(@DefaultValue("19") BigDecimal overheadCoefficientPct) {}
