package com.flagship.banking_ledger.exception;

import com.flagship.banking_ledger.currency.Cents;
import lombok.Getter;

/**
 * Thrown when a withdrawal would take an account below zero.
 * Also raised by the withdrawal leg of a transfer, naming the sending account.
 */
@Getter
public class AccountOverdraftException extends LedgerException {

    private final String name;
    private final Cents balance;
    private final Cents withdrawAmount;

    public AccountOverdraftException(String name, Cents balance, Cents withdrawAmount) {
        super(LedgerErrorCode.ACCOUNT_OVERDRAFT, String.format(
            "account %s would overdraft if %s was withdrawn from balance %s", name, withdrawAmount, balance));
        this.name = name;
        this.balance = balance;
        this.withdrawAmount = withdrawAmount;
    }
}
