package com.budgetpilot.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * findAndModify-based transitions so two starts for the same user cannot both win.
 */
@Repository
@RequiredArgsConstructor
public class CategorizationJobRepositoryImpl implements CategorizationJobRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<CategorizationJob> tryStartProcessing(String userId, String jobId,
                                                          CategorizationJob.Progress progress,
                                                          boolean resumedFromError) {
        Instant now = Instant.now();
        Query query = new Query(where("userId").is(userId)
                .and("status").ne(CategorizationJob.JobStatus.PROCESSING));
        Update update = new Update()
                .set("jobId", jobId)
                .set("status", CategorizationJob.JobStatus.PROCESSING)
                .set("progress", progress)
                .unset("lastError")
                .set("resumedFromError", resumedFromError)
                .set("startedAt", now)
                .set("updatedAt", now)
                .setOnInsert("userId", userId);
        try {
            return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), CategorizationJob.class));
        } catch (DuplicateKeyException e) {
            // upsert raced with an existing PROCESSING document for this user
            return Optional.empty();
        }
    }

    @Override
    public Optional<CategorizationJob> markNothingToProcess(String userId, String jobId) {
        Instant now = Instant.now();
        Query query = new Query(where("userId").is(userId)
                .and("status").ne(CategorizationJob.JobStatus.PROCESSING));
        Update update = new Update()
                .set("jobId", jobId)
                .set("status", CategorizationJob.JobStatus.COMPLETE)
                .unset("progress")
                .unset("lastError")
                .set("resumedFromError", false)
                .set("startedAt", now)
                .set("lastProcessedAt", now)
                .set("updatedAt", now)
                .setOnInsert("userId", userId);
        try {
            return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), CategorizationJob.class));
        } catch (DuplicateKeyException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean updateProgress(String userId, String jobId, CategorizationJob.Progress progress) {
        Query query = runningQuery(userId, jobId);
        Update update = new Update()
                .set("progress", progress)
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, CategorizationJob.class).getModifiedCount() > 0;
    }

    @Override
    public boolean finishRun(String userId, String jobId, CategorizationJob.JobStatus status,
                             CategorizationJob.JobError error) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("status", status)
                .unset("progress")
                .set("lastProcessedAt", now)
                .set("updatedAt", now);
        if (error != null) {
            update.set("lastError", error);
        } else {
            update.unset("lastError");
        }
        return mongoTemplate.updateFirst(runningQuery(userId, jobId), update, CategorizationJob.class)
                .getModifiedCount() > 0;
    }

    private static Query runningQuery(String userId, String jobId) {
        return new Query(where("userId").is(userId)
                .and("jobId").is(jobId)
                .and("status").is(CategorizationJob.JobStatus.PROCESSING));
    }
}
