package com.budgetpilot.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Proposed category assignment for a group of transactions, produced by a classifier batch and resolved by review.
 * {@code transactionIds} is authoritative for commit; {@code affectedTransactions} carries display data in the same order.
 */
@Document(collection = "categorization_suggestions")
@CompoundIndexes({
    @CompoundIndex(name = "user_status_created", def = "{'userId': 1, 'status': 1, 'createdAt': 1}"),
    @CompoundIndex(name = "user_status_matchKey", def = "{'userId': 1, 'status': 1, 'matchKey': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CategorizationSuggestion {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private SuggestedCategory category;
    private Match match;
    /** Normalised keyword used to merge re-emitted groupings into the same pending suggestion. */
    private String matchKey;
    private List<AffectedTransaction> affectedTransactions = new ArrayList<>();
    private List<String> transactionIds = new ArrayList<>();
    private SuggestionStatus status;
    private String jobId;
    private int batchNumber;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant resolvedAt;
    /** Set on APPROVED. */
    private String committedCategoryId;
    private String ruleId;
    /** Set on REJECTED; kept for classifier tuning only. */
    private String rejectionReason;

    public int getAffectedCount() {
        return transactionIds == null ? 0 : transactionIds.size();
    }

    public static String matchKey(String keyword) {
        return keyword == null ? "" : keyword.strip().toUpperCase(Locale.ROOT);
    }

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class Match {
        private MatchType type;
        private String keyword;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class AffectedTransaction {
        private String id;
        private String description;
        private long amount;
        private LocalDate date;
    }
}
