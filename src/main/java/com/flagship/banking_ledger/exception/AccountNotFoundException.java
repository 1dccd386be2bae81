package com.flagship.banking_ledger.exception;

import lombok.Getter;

@Getter
public class AccountNotFoundException extends LedgerException {

    private final String name;

    public AccountNotFoundException(String name) {
        super(LedgerErrorCode.ACCOUNT_NOT_FOUND, "account with name " + name + " not found");
        this.name = name;
    }
}
