package com.budgetpilot.api.controller;

import com.budgetpilot.api.dto.ApproveSuggestionRequest;
import com.budgetpilot.api.dto.ApproveSuggestionResponse;
import com.budgetpilot.api.dto.ClearSuggestionsResponse;
import com.budgetpilot.api.dto.RejectSuggestionRequest;
import com.budgetpilot.api.dto.RejectSuggestionResponse;
import com.budgetpilot.api.dto.SkippedTransactionResponse;
import com.budgetpilot.api.dto.SuggestionResponse;
import com.budgetpilot.api.dto.SuggestionsResponse;
import com.budgetpilot.categorization.config.CategorizationProperties;
import com.budgetpilot.categorization.suggestion.ApproveOverrides;
import com.budgetpilot.categorization.suggestion.ApproveResult;
import com.budgetpilot.categorization.suggestion.ClearResult;
import com.budgetpilot.categorization.suggestion.SuggestionReviewService;
import com.budgetpilot.categorization.suggestion.SuggestionStore;
import com.budgetpilot.categorization.suggestion.SuggestionsView;
import com.budgetpilot.domain.CategorizationSuggestion;
import com.budgetpilot.domain.SkippedTransaction;
import com.budgetpilot.domain.SuggestedCategory;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * GET /suggestions, POST /suggestions/{id}/approve, /suggestions/{id}/reject, /suggestions/clear.
 */
@RestController
@RequestMapping(CategorizationController.BASE_PATH + "/suggestions")
@RequiredArgsConstructor
public class SuggestionController {

    private final SuggestionStore suggestionStore;
    private final SuggestionReviewService reviewService;
    private final CategorizationProperties properties;

    @GetMapping
    public ResponseEntity<SuggestionsResponse> list(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader) {
        String userId = RequestUser.require(userHeader);
        SuggestionsView view = suggestionStore.listPending(userId);
        int previewLimit = Math.max(0, properties.getPreviewLimit());
        List<SuggestionResponse> suggestions = view.suggestions().stream()
                .map(s -> toResponse(s, previewLimit))
                .toList();
        List<SkippedTransactionResponse> skipped = view.skipped().stream()
                .map(SuggestionController::toResponse)
                .toList();
        return ResponseEntity.ok(new SuggestionsResponse(
                suggestions, skipped, view.totalPending(), view.totalSkipped(), view.partial()));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ApproveSuggestionResponse> approve(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @PathVariable String id,
            @Valid @RequestBody(required = false) ApproveSuggestionRequest request) {
        String userId = RequestUser.require(userHeader);
        ApproveOverrides overrides = request == null ? ApproveOverrides.none() : new ApproveOverrides(
                request.categoryId(), request.categoryName(), request.categoryIcon(), request.categoryColor(),
                request.matchType(), request.keyword());
        ApproveResult result = reviewService.approve(userId, id, overrides);
        return ResponseEntity.ok(new ApproveSuggestionResponse(
                result.suggestionId(), result.categoryId(), result.categoryName(), result.ruleId(),
                result.transactionsCategorized(), result.newCategory()));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<RejectSuggestionResponse> reject(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader,
            @PathVariable String id,
            @Valid @RequestBody(required = false) RejectSuggestionRequest request) {
        String userId = RequestUser.require(userHeader);
        CategorizationSuggestion rejected = reviewService.reject(userId, id, request != null ? request.reason() : null);
        return ResponseEntity.ok(new RejectSuggestionResponse(rejected.getId(), wire(rejected.getStatus().name())));
    }

    @PostMapping("/clear")
    public ResponseEntity<ClearSuggestionsResponse> clear(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader) {
        String userId = RequestUser.require(userHeader);
        ClearResult result = reviewService.clearAll(userId);
        return ResponseEntity.ok(new ClearSuggestionsResponse(result.clearedSuggestions(), result.clearedSkipped()));
    }

    static SuggestionResponse toResponse(CategorizationSuggestion s, int previewLimit) {
        List<SuggestionResponse.AffectedTransactionView> preview = s.getAffectedTransactions().stream()
                .limit(previewLimit)
                .map(t -> new SuggestionResponse.AffectedTransactionView(t.getId(), t.getDescription(), t.getAmount(), t.getDate()))
                .toList();
        return new SuggestionResponse(
                s.getId(),
                toView(s.getCategory()),
                new SuggestionResponse.MatchView(s.getMatch().getType().wireName(), s.getMatch().getKeyword()),
                preview,
                s.getAffectedCount(),
                wire(s.getStatus().name()),
                s.getCreatedAt());
    }

    private static SuggestionResponse.CategoryView toView(SuggestedCategory category) {
        if (category instanceof SuggestedCategory.Existing e) {
            return SuggestionResponse.CategoryView.existing(e.categoryId(), e.name(), e.icon(), e.color());
        }
        if (category instanceof SuggestedCategory.Proposed p) {
            return SuggestionResponse.CategoryView.proposed(p.name(), p.icon(), p.color());
        }
        throw new IllegalStateException("Unknown suggested category: " + category);
    }

    private static SkippedTransactionResponse toResponse(SkippedTransaction s) {
        return new SkippedTransactionResponse(s.getTransactionId(), s.getDescription(), s.getAmount(), s.getDate(), s.getReason());
    }

    private static String wire(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }
}
