package com.budgetpilot.api.dto;

import java.time.LocalDate;

public record SkippedTransactionResponse(String id, String description, long amount, LocalDate date, String reason) {
}
