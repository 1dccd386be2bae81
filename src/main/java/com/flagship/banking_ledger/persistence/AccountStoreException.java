package com.flagship.banking_ledger.persistence;

/**
 * Raised when the account store cannot be read or written.
 */
public class AccountStoreException extends RuntimeException {

    public AccountStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
