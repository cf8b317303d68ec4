package com.budgetpilot.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * Ledger transaction as imported for a user. {@code categoryId == null} means uncategorized.
 * Amount is in minor units (cents), negative for expenses.
 */
@Document(collection = "transactions")
@CompoundIndex(name = "user_category_date", def = "{'userId': 1, 'categoryId': 1, 'date': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Transaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String description;
    private long amount;
    private LocalDate date;
    private String categoryId;
}
