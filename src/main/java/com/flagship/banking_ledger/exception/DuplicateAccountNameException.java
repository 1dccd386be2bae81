package com.flagship.banking_ledger.exception;

import lombok.Getter;

@Getter
public class DuplicateAccountNameException extends LedgerException {

    private final String name;

    public DuplicateAccountNameException(String name) {
        super(LedgerErrorCode.DUPLICATE_ACCOUNT_NAME, "account with name " + name + " already exists");
        this.name = name;
    }
}
