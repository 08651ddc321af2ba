package com.example.leads.service.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    /** Target record vanished between snapshot and mutation; re-merge and retry. */
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** Authoritative lead delete affected zero rows. */
    BLOCKED_DELETION(HttpStatus.CONFLICT),
    TRANSIENT_STORE_ERROR(HttpStatus.SERVICE_UNAVAILABLE),
    SUBSCRIPTION_LOST(HttpStatus.SERVICE_UNAVAILABLE),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    BAD_REQUEST(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
