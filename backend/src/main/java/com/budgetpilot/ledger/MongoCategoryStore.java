package com.budgetpilot.ledger;

import com.budgetpilot.config.CaffeineConfig;
import com.budgetpilot.domain.Category;
import com.budgetpilot.domain.CategoryRepository;
import com.budgetpilot.domain.CategoryRule;
import com.budgetpilot.domain.CategoryRuleRepository;
import com.budgetpilot.domain.MatchType;
import com.budgetpilot.domain.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class MongoCategoryStore implements CategoryStore {

    private final CategoryRepository categoryRepository;
    private final CategoryRuleRepository categoryRuleRepository;
    private final TransactionRepository transactionRepository;

    @Override
    @Cacheable(cacheNames = CaffeineConfig.USER_CATEGORIES_CACHE, key = "#userId")
    public List<Category> listCategories(String userId) {
        return categoryRepository.findByUserIdOrderByNameAsc(userId);
    }

    @Override
    public Optional<Category> findById(String userId, String categoryId) {
        if (categoryId == null || categoryId.isBlank()) {
            return Optional.empty();
        }
        return categoryRepository.findByIdAndUserId(categoryId, userId);
    }

    @Override
    public Optional<Category> findByName(String userId, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return categoryRepository.findFirstByUserIdAndNameIgnoreCase(userId, name.strip());
    }

    @Override
    @CacheEvict(cacheNames = CaffeineConfig.USER_CATEGORIES_CACHE, key = "#userId")
    public Category createCategory(String userId, NewCategorySpec spec) {
        Category category = new Category();
        category.setUserId(userId);
        category.setName(spec.name().strip());
        category.setIcon(spec.icon());
        category.setColor(spec.color());
        category.setCreatedAt(Instant.now());
        Category saved = categoryRepository.save(category);
        log.info("Category created for user {}: {} ({})", userId, saved.getName(), saved.getId());
        return saved;
    }

    @Override
    public String createOrUpdateRule(String userId, MatchType matchType, String keyword, String categoryId) {
        String normalized = keyword.strip().toUpperCase(Locale.ROOT);
        Instant now = Instant.now();
        CategoryRule rule = categoryRuleRepository.findByUserIdAndKeyword(userId, normalized)
                .orElseGet(() -> {
                    CategoryRule r = new CategoryRule();
                    r.setUserId(userId);
                    r.setKeyword(normalized);
                    r.setCreatedAt(now);
                    return r;
                });
        rule.setMatchType(matchType);
        rule.setCategoryId(categoryId);
        rule.setUpdatedAt(now);
        try {
            return categoryRuleRepository.save(rule).getId();
        } catch (DuplicateKeyException e) {
            // concurrent insert of the same keyword; update the winner instead
            CategoryRule existing = categoryRuleRepository.findByUserIdAndKeyword(userId, normalized).orElseThrow(() -> e);
            existing.setMatchType(matchType);
            existing.setCategoryId(categoryId);
            existing.setUpdatedAt(now);
            return categoryRuleRepository.save(existing).getId();
        }
    }

    @Override
    public long applyCategoryToTransactions(String userId, String categoryId, Collection<String> transactionIds) {
        return transactionRepository.applyCategory(userId, categoryId, transactionIds);
    }
}
