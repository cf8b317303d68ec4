package com.budgetpilot.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for transactions. Uncategorized selection lives in {@link TransactionRepositoryCustom}.
 */
public interface TransactionRepository extends MongoRepository<Transaction, String>, TransactionRepositoryCustom {

    List<Transaction> findByUserIdAndIdIn(String userId, Collection<String> ids);

    long countByUserIdAndCategoryId(String userId, String categoryId);
}
