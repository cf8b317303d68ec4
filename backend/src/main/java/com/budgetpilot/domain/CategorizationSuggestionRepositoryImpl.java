package com.budgetpilot.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed conditional updates for categorization_suggestions.
 */
@Repository
@RequiredArgsConstructor
public class CategorizationSuggestionRepositoryImpl implements CategorizationSuggestionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<CategorizationSuggestion> claim(String userId, String id, SuggestionStatus target,
                                                    String rejectionReason) {
        Query query = new Query(where("_id").is(id)
                .and("userId").is(userId)
                .and("status").is(SuggestionStatus.PENDING));
        Instant now = Instant.now();
        Update update = new Update()
                .set("status", target)
                .set("resolvedAt", now)
                .set("updatedAt", now);
        if (rejectionReason != null) {
            update.set("rejectionReason", rejectionReason);
        }
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), CategorizationSuggestion.class));
    }

    @Override
    public boolean reopen(String id, List<CategorizationSuggestion.AffectedTransaction> transactions) {
        Update update = new Update()
                .set("status", SuggestionStatus.PENDING)
                .set("affectedTransactions", transactions)
                .set("transactionIds", transactions.stream()
                        .map(CategorizationSuggestion.AffectedTransaction::getId)
                        .toList())
                .unset("resolvedAt")
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(uncommittedApproval(id), update, CategorizationSuggestion.class)
                .getModifiedCount() > 0;
    }

    @Override
    public boolean withdraw(String id, String reason) {
        Update update = new Update()
                .set("status", SuggestionStatus.REJECTED)
                .set("rejectionReason", reason)
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(uncommittedApproval(id), update, CategorizationSuggestion.class)
                .getModifiedCount() > 0;
    }

    private static Query uncommittedApproval(String id) {
        return new Query(where("_id").is(id)
                .and("status").is(SuggestionStatus.APPROVED)
                .and("committedCategoryId").exists(false));
    }

    @Override
    public void recordCommit(String id, SuggestedCategory category, CategorizationSuggestion.Match match,
                             String committedCategoryId, String ruleId) {
        Query query = new Query(where("_id").is(id).and("status").is(SuggestionStatus.APPROVED));
        Update update = new Update()
                .set("category", category)
                .set("match", match)
                .set("committedCategoryId", committedCategoryId)
                .set("ruleId", ruleId)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(query, update, CategorizationSuggestion.class);
    }

    @Override
    public Optional<CategorizationSuggestion> appendToPending(String userId, String matchKey, String jobId,
                                                              int batchNumber,
                                                              List<CategorizationSuggestion.AffectedTransaction> transactions) {
        Query query = new Query(where("userId").is(userId)
                .and("status").is(SuggestionStatus.PENDING)
                .and("matchKey").is(matchKey));
        Update update = new Update()
                .push("affectedTransactions").each(transactions.toArray())
                .push("transactionIds").each(transactions.stream()
                        .map(CategorizationSuggestion.AffectedTransaction::getId)
                        .toArray())
                .set("jobId", jobId)
                .set("batchNumber", batchNumber)
                .set("updatedAt", Instant.now());
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), CategorizationSuggestion.class));
    }

    @Override
    public Set<String> findHeldTransactionIds(String userId) {
        Query query = new Query(held(where("userId").is(userId)));
        return new HashSet<>(mongoTemplate.findDistinct(query, "transactionIds", CategorizationSuggestion.class, String.class));
    }

    @Override
    public Set<String> findHeldAmong(String userId, Collection<String> transactionIds, String exceptSuggestionId) {
        if (transactionIds == null || transactionIds.isEmpty()) {
            return Set.of();
        }
        Criteria criteria = where("userId").is(userId).and("transactionIds").in(transactionIds);
        if (exceptSuggestionId != null) {
            criteria = criteria.and("_id").ne(exceptSuggestionId);
        }
        Set<String> owned = new HashSet<>(mongoTemplate.findDistinct(new Query(held(criteria)), "transactionIds",
                CategorizationSuggestion.class, String.class));
        owned.retainAll(transactionIds);
        return owned;
    }

    /** PENDING, or APPROVED with the ledger commit still outstanding. */
    private static Criteria held(Criteria criteria) {
        return criteria.orOperator(
                where("status").is(SuggestionStatus.PENDING),
                where("status").is(SuggestionStatus.APPROVED).and("committedCategoryId").exists(false));
    }
}
