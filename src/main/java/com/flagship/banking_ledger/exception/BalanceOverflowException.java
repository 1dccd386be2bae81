package com.flagship.banking_ledger.exception;

import com.flagship.banking_ledger.currency.Cents;
import lombok.Getter;

/**
 * Thrown when a deposit would push an account past {@link Cents#MAX}.
 * Also raised by the deposit leg of a transfer, naming the receiving account.
 */
@Getter
public class BalanceOverflowException extends LedgerException {

    private final String name;
    private final Cents depositAmount;

    public BalanceOverflowException(String name, Cents depositAmount) {
        super(LedgerErrorCode.BALANCE_OVERFLOW, String.format(
            "account %s would have balance overflow if %s was deposited", name, depositAmount));
        this.name = name;
        this.depositAmount = depositAmount;
    }
}
