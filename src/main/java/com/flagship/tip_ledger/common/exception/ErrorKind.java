package com.flagship.tip_ledger.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Actionable failure kinds reported by the tip engine.
 *
 * Each kind maps to one HTTP status so collaborators can react without
 * parsing messages.
 */
public enum ErrorKind {

    /** Bad amounts, blank keys, timestamps out of order. */
    VALIDATION(HttpStatus.BAD_REQUEST),

    UNKNOWN_ACCOUNT(HttpStatus.NOT_FOUND),
    UNKNOWN_EMPLOYEE(HttpStatus.NOT_FOUND),
    UNKNOWN_POOL(HttpStatus.NOT_FOUND),
    UNKNOWN_ENTRY(HttpStatus.NOT_FOUND),
    UNKNOWN_DEBT(HttpStatus.NOT_FOUND),
    UNKNOWN_BANKED_SHARE(HttpStatus.NOT_FOUND),
    UNKNOWN_TIP_TRANSACTION(HttpStatus.NOT_FOUND),
    UNKNOWN_RULE(HttpStatus.NOT_FOUND),

    ALREADY_MEMBER(HttpStatus.CONFLICT),
    NOT_MEMBER(HttpStatus.CONFLICT),
    POOL_CLOSED(HttpStatus.CONFLICT),
    ALREADY_RESOLVED(HttpStatus.CONFLICT),
    ALREADY_SETTLED(HttpStatus.CONFLICT),
    NOT_ON_DUTY(HttpStatus.CONFLICT),
    ALREADY_ON_DUTY(HttpStatus.CONFLICT),

    NO_ACTIVE_SEGMENT(HttpStatus.UNPROCESSABLE_ENTITY),
    SEGMENT_NOT_FOUND(HttpStatus.UNPROCESSABLE_ENTITY),
    EMPTY_POOL(HttpStatus.UNPROCESSABLE_ENTITY),

    /** Lost a lock race more times than the retry budget allows. */
    BUSY(HttpStatus.SERVICE_UNAVAILABLE),

    /** A write would have left the ledger or a pool timeline inconsistent. */
    INTEGRITY_VIOLATION(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
