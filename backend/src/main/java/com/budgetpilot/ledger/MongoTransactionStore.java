package com.budgetpilot.ledger;

import com.budgetpilot.domain.Transaction;
import com.budgetpilot.domain.TransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

@Service
@RequiredArgsConstructor
public class MongoTransactionStore implements TransactionStore {

    private final TransactionRepository transactionRepository;

    @Override
    public long countUncategorized(String userId) {
        return transactionRepository.countUncategorized(userId);
    }

    @Override
    public long countUncategorized(String userId, Collection<String> excludedIds) {
        return transactionRepository.countUncategorizedExcluding(userId, excludedIds);
    }

    @Override
    public List<Transaction> fetchUncategorizedBatch(String userId, Collection<String> excludedIds, int offset, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return transactionRepository.findUncategorized(userId, excludedIds, offset, limit);
    }
}
