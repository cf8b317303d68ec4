package com.budgetpilot.categorization.suggestion;

import com.budgetpilot.categorization.CategorizationException;
import com.budgetpilot.domain.CategorizationSuggestion;
import com.budgetpilot.domain.Category;
import com.budgetpilot.domain.MatchType;
import com.budgetpilot.domain.SuggestedCategory;
import com.budgetpilot.domain.SuggestionStatus;
import com.budgetpilot.ledger.CategoryStore;
import com.budgetpilot.ledger.NewCategorySpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Approve (optionally with edits), reject and clear suggestions. Safe while a run is PROCESSING: resolution is a
 * compare-and-swap on the suggestion, so concurrent reviewers get ALREADY_RESOLVED instead of a double commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SuggestionReviewService {

    private final SuggestionStore suggestionStore;
    private final CategoryStore categoryStore;

    /**
     * Claims the suggestion, then commits it to the ledger: resolves or creates the category, creates or updates the
     * keyword rule and assigns the category to the suggestion's still-uncategorized transactions. If the commit fails
     * the suggestion goes back to PENDING.
     *
     * @throws CategorizationException NOT_FOUND, ALREADY_RESOLVED, or INVALID_OVERRIDE for unusable edits
     */
    public ApproveResult approve(String userId, String suggestionId, ApproveOverrides overrides) {
        ApproveOverrides edits = overrides != null ? overrides : ApproveOverrides.none();
        MatchType matchTypeOverride = parseMatchType(edits.matchType());
        if (edits.keyword() != null && edits.keyword().isBlank()) {
            throw new CategorizationException(CategorizationException.INVALID_OVERRIDE, "keyword must not be blank");
        }
        Optional<Category> categoryOverride = Optional.empty();
        if (ApproveOverrides.notBlank(edits.categoryId())) {
            categoryOverride = Optional.of(categoryStore.findById(userId, edits.categoryId())
                    .orElseThrow(() -> new CategorizationException(CategorizationException.INVALID_OVERRIDE,
                            "Category not found: " + edits.categoryId())));
        }

        CategorizationSuggestion suggestion = suggestionStore.claim(userId, suggestionId, SuggestionStatus.APPROVED, null);
        try {
            SuggestedCategory target = effectiveCategory(suggestion.getCategory(), edits, categoryOverride);
            CategorizationSuggestion.Match match = new CategorizationSuggestion.Match(
                    matchTypeOverride != null ? matchTypeOverride : suggestion.getMatch().getType(),
                    edits.keyword() != null ? edits.keyword().strip() : suggestion.getMatch().getKeyword());

            boolean created = false;
            Category category;
            if (target instanceof SuggestedCategory.Existing existing) {
                Optional<Category> found = categoryStore.findById(userId, existing.categoryId())
                        .or(() -> categoryStore.findByName(userId, existing.name()));
                created = found.isEmpty();
                category = found.orElseGet(() -> categoryStore.createCategory(userId,
                        new NewCategorySpec(existing.name(), existing.icon(), existing.color())));
            } else if (target instanceof SuggestedCategory.Proposed proposed) {
                Optional<Category> found = categoryStore.findByName(userId, proposed.name());
                created = found.isEmpty();
                category = found.orElseGet(() -> categoryStore.createCategory(userId,
                        new NewCategorySpec(proposed.name(), proposed.icon(), proposed.color())));
            } else {
                throw new IllegalStateException("Unknown suggested category: " + target);
            }

            String ruleId = categoryStore.createOrUpdateRule(userId, match.getType(), match.getKeyword(), category.getId());
            long applied = categoryStore.applyCategoryToTransactions(userId, category.getId(), suggestion.getTransactionIds());
            suggestionStore.recordCommit(suggestionId,
                    new SuggestedCategory.Existing(category.getId(), category.getName(), category.getIcon(), category.getColor()),
                    match, category.getId(), ruleId);
            log.info("Suggestion {} approved for user {}: category {} ({}), rule {}, {}/{} transactions categorized",
                    suggestionId, userId, category.getName(), created ? "new" : "existing", ruleId,
                    applied, suggestion.getAffectedCount());
            return new ApproveResult(suggestionId, category.getId(), category.getName(), ruleId, applied, created);
        } catch (RuntimeException e) {
            boolean released = suggestionStore.release(userId, suggestionId);
            log.warn("Approval of suggestion {} for user {} failed, released={}: {}", suggestionId, userId, released, e.getMessage());
            throw e;
        }
    }

    /**
     * @throws CategorizationException NOT_FOUND or ALREADY_RESOLVED
     */
    public CategorizationSuggestion reject(String userId, String suggestionId, String reason) {
        String storedReason = reason == null || reason.isBlank() ? null : reason.strip();
        CategorizationSuggestion rejected = suggestionStore.claim(userId, suggestionId, SuggestionStatus.REJECTED, storedReason);
        log.info("Suggestion {} rejected for user {}", suggestionId, userId);
        return rejected;
    }

    public ClearResult clearAll(String userId) {
        return suggestionStore.clearAll(userId);
    }

    private static SuggestedCategory effectiveCategory(SuggestedCategory current, ApproveOverrides edits,
                                                       Optional<Category> categoryOverride) {
        if (categoryOverride.isPresent()) {
            Category c = categoryOverride.get();
            return new SuggestedCategory.Existing(c.getId(), c.getName(), c.getIcon(), c.getColor());
        }
        if (!edits.editsCategory()) {
            return current;
        }
        if (current instanceof SuggestedCategory.Existing && !ApproveOverrides.notBlank(edits.categoryName())) {
            // icon/colour edits do not modify a category the user already has
            return current;
        }
        return new SuggestedCategory.Proposed(
                ApproveOverrides.notBlank(edits.categoryName()) ? edits.categoryName().strip() : current.name(),
                ApproveOverrides.notBlank(edits.categoryIcon()) ? edits.categoryIcon() : current.icon(),
                ApproveOverrides.notBlank(edits.categoryColor()) ? edits.categoryColor() : current.color());
    }

    private static MatchType parseMatchType(String value) {
        if (value == null) {
            return null;
        }
        try {
            return MatchType.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new CategorizationException(CategorizationException.INVALID_OVERRIDE, "Unsupported match_type: " + value);
        }
    }
}
