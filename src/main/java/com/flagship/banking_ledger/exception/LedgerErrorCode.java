package com.flagship.banking_ledger.exception;

/**
 * Error codes for rejected ledger operations.
 *
 * Every code is recoverable: the operation that raised it left the ledger untouched.
 */
public enum LedgerErrorCode {
    INVALID_AMOUNT,
    AMOUNT_OVERFLOW,
    EMPTY_ACCOUNT_NAME,
    DUPLICATE_ACCOUNT_NAME,
    ACCOUNT_NOT_FOUND,
    BALANCE_OVERFLOW,
    ACCOUNT_OVERDRAFT
}
