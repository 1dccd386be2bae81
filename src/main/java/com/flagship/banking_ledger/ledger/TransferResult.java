package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.currency.Cents;
import lombok.Value;

/**
 * Outcome of a committed transfer: both balances after the two legs were applied.
 */
@Value
public class TransferResult {
    String fromName;
    Cents fromBalance;
    String toName;
    Cents toBalance;
    Cents amount;
}
