package com.budgetpilot.api.controller;

/**
 * Request did not identify a user (missing or blank X-User-Id header). Mapped to 400 MISSING_USER.
 */
public class MissingUserException extends RuntimeException {

    public MissingUserException() {
        super(RequestUser.HEADER + " header is required");
    }
}
