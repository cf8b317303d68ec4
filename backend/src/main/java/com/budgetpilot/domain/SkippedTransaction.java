package com.budgetpilot.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Transaction the classifier declined (or failed) to categorize in a run, with the reason.
 */
@Document(collection = "categorization_skipped")
@CompoundIndex(name = "user_transaction", def = "{'userId': 1, 'transactionId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SkippedTransaction {

    public static final String REASON_NOT_CLASSIFIED = "NOT_CLASSIFIED";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String transactionId;
    private String description;
    private long amount;
    private LocalDate date;
    private String reason;
    private String jobId;
    private Instant createdAt;
}
