package com.flagship.banking_ledger.exception;

public class EmptyAccountNameException extends LedgerException {

    public EmptyAccountNameException() {
        super(LedgerErrorCode.EMPTY_ACCOUNT_NAME, "account name cannot not be empty");
    }
}
