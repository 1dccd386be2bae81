package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.currency.Cents;
import com.flagship.banking_ledger.exception.AccountOverdraftException;
import com.flagship.banking_ledger.exception.BalanceOverflowException;
import com.flagship.banking_ledger.exception.EmptyAccountNameException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * A named account holding a {@link Cents} balance.
 *
 * Only {@link Ledger} mutates accounts. Instances handed out by the ledger
 * are snapshots, so holding one never aliases ledger state.
 */
@Getter
@EqualsAndHashCode
public class Account {

    private final String name;
    private Cents balance;

    public Account(String name, Cents balance) {
        if (name == null || name.isEmpty()) {
            throw new EmptyAccountNameException();
        }
        this.name = name;
        this.balance = Objects.requireNonNull(balance, "balance");
    }

    /**
     * Adds {@code amount} to the balance.
     *
     * @return the new balance
     * @throws BalanceOverflowException if the balance would exceed {@link Cents#MAX}; the balance is left as it was
     */
    Cents deposit(Cents amount) {
        this.balance = balance.plus(amount)
            .orElseThrow(() -> new BalanceOverflowException(name, amount));
        return balance;
    }

    /**
     * Takes {@code amount} out of the balance.
     *
     * @return the new balance
     * @throws AccountOverdraftException if the balance would go negative; the balance is left as it was
     */
    Cents withdraw(Cents amount) {
        this.balance = balance.minus(amount)
            .orElseThrow(() -> new AccountOverdraftException(name, balance, amount));
        return balance;
    }

    Account snapshot() {
        return new Account(name, balance);
    }

    @Override
    public String toString() {
        return "name: " + name + "\tbalance: " + balance;
    }
}
