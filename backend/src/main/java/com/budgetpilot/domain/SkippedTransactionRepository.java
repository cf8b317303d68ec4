package com.budgetpilot.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface SkippedTransactionRepository extends MongoRepository<SkippedTransaction, String> {

    List<SkippedTransaction> findByUserIdOrderByCreatedAtAsc(String userId);

    List<SkippedTransaction> findByUserIdAndJobId(String userId, String jobId);

    long countByUserId(String userId);

    long deleteByUserIdAndTransactionIdIn(String userId, Collection<String> transactionIds);

    long deleteByUserId(String userId);
}
