package com.budgetpilot.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for categorization_suggestions. Status transitions go through
 * {@link CategorizationSuggestionRepositoryCustom} so they are compare-and-swap.
 */
public interface CategorizationSuggestionRepository
        extends MongoRepository<CategorizationSuggestion, String>, CategorizationSuggestionRepositoryCustom {

    List<CategorizationSuggestion> findByUserIdAndStatusOrderByCreatedAtAsc(String userId, SuggestionStatus status);

    Optional<CategorizationSuggestion> findByIdAndUserId(String id, String userId);

    long countByUserIdAndStatus(String userId, SuggestionStatus status);

    long deleteByUserIdAndStatus(String userId, SuggestionStatus status);
}
