package com.example.storefront.exception;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends ApiException {

    public enum Reason {
        MISSING_TOKEN("Missing admin token"),
        INVALID_TOKEN("Invalid token"),
        SESSION_EXPIRED("Session expired"),
        INVALID_CREDENTIALS("Invalid credentials");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public UnauthorizedException(Reason reason) {
        super(HttpStatus.UNAUTHORIZED, "unauthorized", reason.message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
