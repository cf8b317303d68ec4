package com.budgetpilot.api.dto;

import jakarta.validation.constraints.Size;

public record RejectSuggestionRequest(@Size(max = 500) String reason) {
}
