package com.budgetpilot.api.controller;

import com.budgetpilot.categorization.CategorizationException;
import com.budgetpilot.categorization.config.CategorizationProperties;
import com.budgetpilot.categorization.job.CategorizationJobService;
import com.budgetpilot.categorization.job.StartResult;
import com.budgetpilot.categorization.status.CategorizationStatus;
import com.budgetpilot.categorization.status.CategorizationStatusService;
import com.budgetpilot.categorization.suggestion.ApproveOverrides;
import com.budgetpilot.categorization.suggestion.ApproveResult;
import com.budgetpilot.categorization.suggestion.ClearResult;
import com.budgetpilot.categorization.suggestion.SuggestionReviewService;
import com.budgetpilot.categorization.suggestion.SuggestionStore;
import com.budgetpilot.categorization.suggestion.SuggestionsView;
import com.budgetpilot.domain.CategorizationJob;
import com.budgetpilot.domain.CategorizationSuggestion;
import com.budgetpilot.domain.MatchType;
import com.budgetpilot.domain.SkippedTransaction;
import com.budgetpilot.domain.SuggestedCategory;
import com.budgetpilot.domain.SuggestionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = { CategorizationController.class, SuggestionController.class })
@Import(CategorizationControllerTest.PropertiesConfig.class)
class CategorizationControllerTest {

    private static final String BASE = CategorizationController.BASE_PATH;
    private static final String USER = "user-1";

    @TestConfiguration
    @EnableConfigurationProperties(CategorizationProperties.class)
    static class PropertiesConfig {
    }

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    CategorizationJobService jobService;
    @MockBean
    CategorizationStatusService statusService;
    @MockBean
    SuggestionStore suggestionStore;
    @MockBean
    SuggestionReviewService reviewService;

    @Test
    @DisplayName("POST /start returns 200 with job id and snake_case fields")
    void startProcessing() {
        when(jobService.start(USER)).thenReturn(new StartResult("job-1", StartResult.PROCESSING, 78,
                "Categorization started for remaining 78 transactions"));

        webTestClient.post().uri(BASE + "/start").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.job_id").isEqualTo("job-1")
                .jsonPath("$.status").isEqualTo("processing")
                .jsonPath("$.message").isEqualTo("Categorization started for remaining 78 transactions")
                .jsonPath("$.transactions_to_process").isEqualTo(78);
    }

    @Test
    @DisplayName("POST /start with nothing left to categorize returns 200 with status complete")
    void startNothingToProcess() {
        when(jobService.start(USER)).thenReturn(new StartResult("job-2", StartResult.COMPLETE, 0,
                "No uncategorized transactions to process"));

        webTestClient.post().uri(BASE + "/start").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("complete")
                .jsonPath("$.transactions_to_process").isEqualTo(0);
    }

    @Test
    @DisplayName("POST /start while processing returns 409 ALREADY_PROCESSING")
    void startConflict() {
        when(jobService.start(USER)).thenThrow(CategorizationException.alreadyProcessing(USER));

        webTestClient.post().uri(BASE + "/start").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("ALREADY_PROCESSING")
                .jsonPath("$.timestamp").exists();
    }

    @Test
    @DisplayName("requests without X-User-Id are rejected with 400 MISSING_USER")
    void missingUser() {
        webTestClient.get().uri(BASE + "/status")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("MISSING_USER");
    }

    @Test
    @DisplayName("GET /status exposes progress while processing")
    void statusWhileProcessing() {
        when(statusService.getStatus(USER)).thenReturn(new CategorizationStatus(156, true, 3, 2, null, false, null,
                new CategorizationJob.Progress(80, 158, 2, 4)));

        webTestClient.get().uri(BASE + "/status").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.uncategorized_count").isEqualTo(156)
                .jsonPath("$.is_processing").isEqualTo(true)
                .jsonPath("$.pending_suggestions_count").isEqualTo(3)
                .jsonPath("$.skipped_count").isEqualTo(2)
                .jsonPath("$.has_error").isEqualTo(false)
                .jsonPath("$.progress.processed_transactions").isEqualTo(80)
                .jsonPath("$.progress.total_transactions").isEqualTo(158)
                .jsonPath("$.progress.current_batch").isEqualTo(2)
                .jsonPath("$.progress.total_batches").isEqualTo(4);
    }

    @Test
    @DisplayName("GET /status reports the last error with retryable flag")
    void statusWithError() {
        Instant at = Instant.parse("2025-03-01T10:00:00Z");
        when(statusService.getStatus(USER)).thenReturn(new CategorizationStatus(78, false, 20, 0, at, true,
                new CategorizationJob.JobError("AI_RATE_LIMITED", "Rate limited after batch 2. 20 suggestions saved.", true, at),
                null));

        webTestClient.get().uri(BASE + "/status").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.has_error").isEqualTo(true)
                .jsonPath("$.error.code").isEqualTo("AI_RATE_LIMITED")
                .jsonPath("$.error.message").isEqualTo("Rate limited after batch 2. 20 suggestions saved.")
                .jsonPath("$.error.retryable").isEqualTo(true)
                .jsonPath("$.progress").doesNotExist();
    }

    @Test
    @DisplayName("GET /suggestions truncates affected_transactions to the preview limit but keeps affected_count")
    void listSuggestions() {
        CategorizationSuggestion s = new CategorizationSuggestion();
        s.setId("s-1");
        s.setCategory(new SuggestedCategory.Proposed("Coffee", "folder", "#6B7280"));
        s.setMatch(new CategorizationSuggestion.Match(MatchType.CONTAINS, "STARBUCKS"));
        s.setStatus(SuggestionStatus.PENDING);
        s.setCreatedAt(Instant.parse("2025-03-01T10:00:00Z"));
        List<CategorizationSuggestion.AffectedTransaction> affected = new ArrayList<>();
        IntStream.range(0, 25).forEach(i -> affected.add(new CategorizationSuggestion.AffectedTransaction(
                "tx-" + i, "STARBUCKS #" + i, -450L, LocalDate.of(2025, 3, 1))));
        s.setAffectedTransactions(affected);
        s.setTransactionIds(new ArrayList<>(affected.stream().map(CategorizationSuggestion.AffectedTransaction::getId).toList()));
        SkippedTransaction skipped = new SkippedTransaction();
        skipped.setTransactionId("tx-99");
        skipped.setDescription("POS 0042");
        skipped.setAmount(-1200L);
        skipped.setDate(LocalDate.of(2025, 3, 2));
        skipped.setReason(SkippedTransaction.REASON_NOT_CLASSIFIED);
        when(suggestionStore.listPending(USER)).thenReturn(new SuggestionsView(List.of(s), List.of(skipped), 1, 1, true));

        webTestClient.get().uri(BASE + "/suggestions").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.is_partial").isEqualTo(true)
                .jsonPath("$.total_pending").isEqualTo(1)
                .jsonPath("$.total_skipped").isEqualTo(1)
                .jsonPath("$.suggestions[0].id").isEqualTo("s-1")
                .jsonPath("$.suggestions[0].category.type").isEqualTo("new")
                .jsonPath("$.suggestions[0].category.new_name").isEqualTo("Coffee")
                .jsonPath("$.suggestions[0].category.new_color").isEqualTo("#6B7280")
                .jsonPath("$.suggestions[0].category.existing_id").doesNotExist()
                .jsonPath("$.suggestions[0].match.type").isEqualTo("contains")
                .jsonPath("$.suggestions[0].match.keyword").isEqualTo("STARBUCKS")
                .jsonPath("$.suggestions[0].affected_transactions.length()").isEqualTo(20)
                .jsonPath("$.suggestions[0].affected_transactions[0].amount").isEqualTo(-450)
                .jsonPath("$.suggestions[0].affected_transactions[0].date").isEqualTo("2025-03-01")
                .jsonPath("$.suggestions[0].affected_count").isEqualTo(25)
                .jsonPath("$.suggestions[0].status").isEqualTo("pending")
                .jsonPath("$.skipped_transactions[0].id").isEqualTo("tx-99")
                .jsonPath("$.skipped_transactions[0].reason").isEqualTo("NOT_CLASSIFIED");
    }

    @Test
    @DisplayName("POST approve with an edit body passes overrides and returns the commit result")
    void approveWithEdits() {
        when(reviewService.approve(eq(USER), eq("s-1"), any())).thenReturn(
                new ApproveResult("s-1", "cat-9", "Coffee Shops", "rule-1", 12, true));

        webTestClient.post().uri(BASE + "/suggestions/s-1/approve").header("X-User-Id", USER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"category_name\":\"Coffee Shops\",\"match_type\":\"exact\",\"keyword\":\"STARBUCKS\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.suggestion_id").isEqualTo("s-1")
                .jsonPath("$.category_id").isEqualTo("cat-9")
                .jsonPath("$.rule_id").isEqualTo("rule-1")
                .jsonPath("$.transactions_categorized").isEqualTo(12)
                .jsonPath("$.is_new_category").isEqualTo(true);

        verify(reviewService).approve(USER, "s-1",
                new ApproveOverrides(null, "Coffee Shops", null, null, "exact", "STARBUCKS"));
    }

    @Test
    @DisplayName("POST approve without a body approves as suggested")
    void approveWithoutBody() {
        when(reviewService.approve(USER, "s-1", ApproveOverrides.none())).thenReturn(
                new ApproveResult("s-1", "cat-1", "Coffee", "rule-1", 3, false));

        webTestClient.post().uri(BASE + "/suggestions/s-1/approve").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.is_new_category").isEqualTo(false);
    }

    @Test
    @DisplayName("invalid colour in the edit body is a 400 VALIDATION_ERROR")
    void approveValidation() {
        webTestClient.post().uri(BASE + "/suggestions/s-1/approve").header("X-User-Id", USER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"category_color\":\"blue\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
        verify(reviewService, never()).approve(any(), any(), any());
    }

    @Test
    @DisplayName("approving a resolved suggestion is 409 ALREADY_RESOLVED, an unknown one 404 NOT_FOUND")
    void approveErrors() {
        when(reviewService.approve(eq(USER), eq("done"), any()))
                .thenThrow(new CategorizationException(CategorizationException.ALREADY_RESOLVED, "Suggestion already resolved: done"));
        when(reviewService.approve(eq(USER), eq("missing"), any()))
                .thenThrow(new CategorizationException(CategorizationException.NOT_FOUND, "Suggestion not found: missing"));

        webTestClient.post().uri(BASE + "/suggestions/done/approve").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody().jsonPath("$.error").isEqualTo("ALREADY_RESOLVED");
        webTestClient.post().uri(BASE + "/suggestions/missing/approve").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    @DisplayName("POST reject returns the rejected status")
    void reject() {
        CategorizationSuggestion rejected = new CategorizationSuggestion();
        rejected.setId("s-1");
        rejected.setStatus(SuggestionStatus.REJECTED);
        when(reviewService.reject(USER, "s-1", "wrong")).thenReturn(rejected);

        webTestClient.post().uri(BASE + "/suggestions/s-1/reject").header("X-User-Id", USER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"reason\":\"wrong\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.suggestion_id").isEqualTo("s-1")
                .jsonPath("$.status").isEqualTo("rejected");
    }

    @Test
    @DisplayName("POST clear returns cleared counts")
    void clear() {
        when(reviewService.clearAll(USER)).thenReturn(new ClearResult(4, 2));

        webTestClient.post().uri(BASE + "/suggestions/clear").header("X-User-Id", USER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cleared_suggestions").isEqualTo(4)
                .jsonPath("$.cleared_skipped").isEqualTo(2);
    }
}
