package com.budgetpilot.api.controller;

import com.budgetpilot.api.dto.CategorizationStatusResponse;
import com.budgetpilot.api.dto.StartCategorizationResponse;
import com.budgetpilot.categorization.job.CategorizationJobService;
import com.budgetpilot.categorization.job.StartResult;
import com.budgetpilot.categorization.status.CategorizationStatus;
import com.budgetpilot.categorization.status.CategorizationStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /start, GET /status. Start answers 200 in both outcomes; the body's status tells "processing" from "complete".
 */
@RestController
@RequestMapping(CategorizationController.BASE_PATH)
@RequiredArgsConstructor
public class CategorizationController {

    public static final String BASE_PATH = "/api/v1/ai/categorization";

    private final CategorizationJobService jobService;
    private final CategorizationStatusService statusService;

    @PostMapping("/start")
    public ResponseEntity<StartCategorizationResponse> start(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader) {
        String userId = RequestUser.require(userHeader);
        StartResult result = jobService.start(userId);
        StartCategorizationResponse body = new StartCategorizationResponse(
                result.jobId(), result.status(), result.message(), result.transactionsToProcess());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/status")
    public ResponseEntity<CategorizationStatusResponse> status(
            @RequestHeader(value = RequestUser.HEADER, required = false) String userHeader) {
        String userId = RequestUser.require(userHeader);
        return ResponseEntity.ok(toResponse(statusService.getStatus(userId)));
    }

    private static CategorizationStatusResponse toResponse(CategorizationStatus s) {
        CategorizationStatusResponse.ErrorInfo error = s.error() == null ? null
                : new CategorizationStatusResponse.ErrorInfo(
                        s.error().getCode(), s.error().getMessage(), s.error().isRetryable(), s.error().getTimestamp());
        CategorizationStatusResponse.ProgressInfo progress = s.progress() == null ? null
                : new CategorizationStatusResponse.ProgressInfo(
                        s.progress().getProcessedTransactions(),
                        s.progress().getTotalTransactions(),
                        s.progress().getCurrentBatch(),
                        s.progress().getTotalBatches());
        return new CategorizationStatusResponse(
                s.uncategorizedCount(),
                s.processing(),
                s.pendingSuggestionsCount(),
                s.skippedCount(),
                s.lastProcessedAt(),
                s.hasError(),
                error,
                progress);
    }
}
