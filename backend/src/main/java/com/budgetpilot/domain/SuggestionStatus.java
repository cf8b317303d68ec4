package com.budgetpilot.domain;

public enum SuggestionStatus {
    PENDING,
    APPROVED,
    REJECTED
}
