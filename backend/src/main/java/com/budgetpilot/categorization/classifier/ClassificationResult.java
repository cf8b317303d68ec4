package com.budgetpilot.categorization.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Classifier answer for one batch. Ids may be missing from both lists; the runner records those as skipped.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationResult(List<Grouping> groupings, List<Skip> skipped) {

    public ClassificationResult {
        groupings = groupings == null ? List.of() : groupings;
        skipped = skipped == null ? List.of() : skipped;
    }

    /** matchType is the wire form ("contains" or "exact"). */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Grouping(String keyword, String matchType, CategoryGuess categoryGuess, List<String> transactionIds) {

        public Grouping {
            transactionIds = transactionIds == null ? List.of() : transactionIds;
        }
    }

    /** existingId is set when the classifier picked one of the request's categories. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CategoryGuess(String existingId, String name, String icon, String color) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Skip(String transactionId, String reason) {
    }
}
