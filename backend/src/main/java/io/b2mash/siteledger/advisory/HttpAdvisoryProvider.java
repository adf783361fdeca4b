package io.b2mash.siteledger.advisory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts the KPI snapshot to an external advisor and maps its answer to {@link Suggestion}s. Each
 * attempt is bounded by the configured timeout. Transport failures are retried twice, after
 * {@code siteledger.advisory.retry-delay-ms} (1s by default) and then twice that, before falling
 * back to an empty list. Entries with an unknown category or severity are skipped.
 */
@Component
@ConditionalOnProperty(name = "siteledger.advisory.enabled", havingValue = "true")
public class HttpAdvisoryProvider implements AdvisoryProvider {

  private static final Logger log = LoggerFactory.getLogger(HttpAdvisoryProvider.class);

  static final String SUGGESTIONS_PATH = "/suggestions";

  private final RestClient restClient;
  private final AdvisoryProperties properties;

  @Autowired
  public HttpAdvisoryProvider(RestClient.Builder builder, AdvisoryProperties properties) {
    this(configure(builder, properties).build(), properties);
  }

  HttpAdvisoryProvider(RestClient restClient, AdvisoryProperties properties) {
    this.restClient = restClient;
    this.properties = properties;
  }

  @Override
  public String providerId() {
    return "http";
  }

  @Override
  @Retryable(
      retryFor = RestClientException.class,
      maxAttempts = 3,
      backoff =
          @Backoff(delayExpression = "${siteledger.advisory.retry-delay-ms:1000}", multiplier = 2))
  public List<Suggestion> generateSuggestions(Map<String, String> kpis) {
    var response =
        restClient
            .post()
            .uri(SUGGESTIONS_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .body(new AdvisoryRequest(kpis))
            .retrieve()
            .body(AdvisoryResponse.class);
    if (response == null || response.suggestions() == null) {
      log.info("Advisor returned no suggestions");
      return List.of();
    }
    var suggestions =
        response.suggestions().stream()
            .map(HttpAdvisoryProvider::toSuggestion)
            .filter(Objects::nonNull)
            .limit(properties.maxSuggestions())
            .toList();
    log.info(
        "Advisor returned {} suggestion(s), {} usable",
        response.suggestions().size(),
        suggestions.size());
    return suggestions;
  }

  @Recover
  public List<Suggestion> recover(RuntimeException e, Map<String, String> kpis) {
    log.warn("Advisory call failed, falling back to rule-based suggestions: {}", e.getMessage());
    return List.of();
  }

  private static Suggestion toSuggestion(AdvisorySuggestion raw) {
    var type = SuggestionType.fromCode(raw.type());
    if (type.isEmpty() || raw.severity() == null || raw.title() == null) {
      log.debug("Skipping advisory suggestion with type={} severity={}", raw.type(), raw.severity());
      return null;
    }
    SuggestionSeverity severity;
    try {
      severity = SuggestionSeverity.valueOf(raw.severity().trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      log.debug("Skipping advisory suggestion with unknown severity {}", raw.severity());
      return null;
    }
    var impact =
        raw.estimatedImpactHt() != null ? raw.estimatedImpactHt().abs() : BigDecimal.ZERO;
    return new Suggestion(type.get(), severity, raw.title(), raw.description(), impact);
  }

  private static RestClient.Builder configure(
      RestClient.Builder builder, AdvisoryProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory);
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
    }
    return builder;
  }

  record AdvisoryRequest(Map<String, String> kpis) {}

  record AdvisoryResponse(List<AdvisorySuggestion> suggestions) {}

  record AdvisorySuggestion(
      String type,
      String severity,
      String title,
      String description,
      BigDecimal estimatedImpactHt) {}
}
