package com.budgetpilot.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface CategoryRuleRepository extends MongoRepository<CategoryRule, String> {

    Optional<CategoryRule> findByUserIdAndKeyword(String userId, String keyword);
}
