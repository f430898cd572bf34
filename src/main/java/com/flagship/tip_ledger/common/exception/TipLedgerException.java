package com.flagship.tip_ledger.common.exception;

import lombok.Getter;

/**
 * Single unchecked failure type for the tip engine.
 * Callers switch on {@link #getKind()} rather than on subclasses.
 */
@Getter
public class TipLedgerException extends RuntimeException {

    private final ErrorKind kind;

    public TipLedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TipLedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static TipLedgerException of(ErrorKind kind, String format, Object... args) {
        return new TipLedgerException(kind, String.format(format, args));
    }

    public static TipLedgerException validation(String format, Object... args) {
        return of(ErrorKind.VALIDATION, format, args);
    }

    public boolean is(ErrorKind candidate) {
        return kind == candidate;
    }
}
