package com.budgetpilot.api.controller;

/**
 * Resolves the calling user. Authentication happens upstream; the gateway forwards the user id in a header.
 */
final class RequestUser {

    static final String HEADER = "X-User-Id";

    private RequestUser() {
    }

    static String require(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            throw new MissingUserException();
        }
        return headerValue.strip();
    }
}
