package io.b2mash.siteledger.advisory;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param defaultDurationMonths assumed project length used for the planned monthly budget
 * @param largeProjectThreshold revised budget above which regular progress statements are advised
 */
@ConfigurationProperties(prefix = "siteledger.forecast")
public record ForecastProperties(
    @DefaultValue("12") int defaultDurationMonths,
    @DefaultValue("100000.00") BigDecimal largeProjectThreshold) {}
