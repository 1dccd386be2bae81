package com.flagship.banking_ledger.exception;

import lombok.Getter;

/**
 * Thrown when amount text is well-formed but exceeds the representable range.
 */
@Getter
public class AmountOverflowException extends LedgerException {

    private final String text;

    public AmountOverflowException(String text) {
        super(LedgerErrorCode.AMOUNT_OVERFLOW, "amount " + text + " would overflow");
        this.text = text;
    }
}
