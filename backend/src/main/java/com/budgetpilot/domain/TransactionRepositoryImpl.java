package com.budgetpilot.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed custom queries for transactions.
 */
@Repository
@RequiredArgsConstructor
public class TransactionRepositoryImpl implements TransactionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public long countUncategorized(String userId) {
        return mongoTemplate.count(new Query(uncategorized(userId)), Transaction.class);
    }

    @Override
    public long countUncategorizedExcluding(String userId, Collection<String> excludedIds) {
        return mongoTemplate.count(new Query(uncategorizedExcluding(userId, excludedIds)), Transaction.class);
    }

    @Override
    public List<Transaction> findUncategorized(String userId, Collection<String> excludedIds, int offset, int limit) {
        Query query = new Query(uncategorizedExcluding(userId, excludedIds))
                .with(Sort.by(Sort.Order.asc("date"), Sort.Order.asc("_id")))
                .skip(Math.max(0, offset))
                .limit(limit);
        return mongoTemplate.find(query, Transaction.class);
    }

    @Override
    public long applyCategory(String userId, String categoryId, Collection<String> transactionIds) {
        if (transactionIds == null || transactionIds.isEmpty()) {
            return 0;
        }
        Query query = new Query(where("userId").is(userId)
                .and("_id").in(transactionIds)
                .and("categoryId").is(null));
        return mongoTemplate.updateMulti(query, new Update().set("categoryId", categoryId), Transaction.class)
                .getModifiedCount();
    }

    private static Criteria uncategorized(String userId) {
        return where("userId").is(userId).and("categoryId").is(null);
    }

    private static Criteria uncategorizedExcluding(String userId, Collection<String> excludedIds) {
        Criteria criteria = uncategorized(userId);
        if (excludedIds != null && !excludedIds.isEmpty()) {
            criteria = criteria.and("_id").nin(excludedIds);
        }
        return criteria;
    }
}
