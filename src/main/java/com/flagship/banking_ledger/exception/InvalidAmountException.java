package com.flagship.banking_ledger.exception;

import lombok.Getter;

/**
 * Thrown when amount text does not match the decimal grammar.
 */
@Getter
public class InvalidAmountException extends LedgerException {

    private final String text;

    public InvalidAmountException(String text) {
        super(LedgerErrorCode.INVALID_AMOUNT, String.format(
            "invalid amount \"%s\", must be a non-negative number only containing digits up to two decimal places",
            text));
        this.text = text;
    }
}
