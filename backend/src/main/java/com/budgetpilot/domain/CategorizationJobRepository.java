package com.budgetpilot.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for categorization_jobs. State transitions go through {@link CategorizationJobRepositoryCustom}.
 */
public interface CategorizationJobRepository extends MongoRepository<CategorizationJob, String>, CategorizationJobRepositoryCustom {

    Optional<CategorizationJob> findByUserId(String userId);

    /** Runs left PROCESSING by a previous process (resume after restart). */
    List<CategorizationJob> findByStatus(CategorizationJob.JobStatus status);
}
