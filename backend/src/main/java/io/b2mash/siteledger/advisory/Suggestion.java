package io.b2mash.siteledger.advisory;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.math.BigDecimal;

/**
 * One actionable recommendation for a project's finances.
 *
 * @param estimatedImpactHt order of magnitude of the money at stake, never negative
 */
public record Suggestion(
    SuggestionType type,
    SuggestionSeverity severity,
    String title,
    String description,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal estimatedImpactHt) {}
