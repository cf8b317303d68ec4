package com.budgetpilot.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Keyword rule mapping future transactions to a category. One rule per (userId, keyword).
 */
@Document(collection = "category_rules")
@CompoundIndex(name = "user_keyword", def = "{'userId': 1, 'keyword': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CategoryRule {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private MatchType matchType;
    /** Stored upper-cased and trimmed. */
    private String keyword;
    private String categoryId;
    private Instant createdAt;
    private Instant updatedAt;
}
