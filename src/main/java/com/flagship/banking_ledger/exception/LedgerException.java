package com.flagship.banking_ledger.exception;

import lombok.Getter;

/**
 * Base exception for operations the ledger refuses to apply.
 *
 * A LedgerException always means the operation was aborted before any account
 * was mutated. Callers may render the message and carry on; internal
 * consistency failures are reported with {@link IllegalStateException} instead.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    protected LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
