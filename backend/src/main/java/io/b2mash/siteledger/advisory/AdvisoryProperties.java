package io.b2mash.siteledger.advisory;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * External advisor settings.
 *
 * @param enabled selects {@link HttpAdvisoryProvider} instead of {@link NoOpAdvisoryProvider}
 * @param baseUrl advisor root URL, suggestions are posted to {@code /suggestions}
 * @param apiKey sent as a bearer token when present
 * @param timeout connect and read timeout per attempt
 * @param maxSuggestions cap applied to the merged suggestion list
 */
@ConfigurationProperties(prefix = "siteledger.advisory")
public record AdvisoryProperties(
    @DefaultValue("false") boolean enabled,
    String baseUrl,
    String apiKey,
    @DefaultValue("30s") Duration timeout,
    @DefaultValue("5") int maxSuggestions) {}
