package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.currency.Cents;
import com.flagship.banking_ledger.exception.AccountNotFoundException;
import com.flagship.banking_ledger.exception.AccountOverdraftException;
import com.flagship.banking_ledger.exception.DuplicateAccountNameException;
import com.flagship.banking_ledger.exception.EmptyAccountNameException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered collection of uniquely named accounts.
 *
 * This class enforces the core invariants:
 * 1. No balance goes below zero or above {@link Cents#MAX}
 * 2. Account names are non-empty and unique
 * 3. A rejected operation leaves every account untouched
 * 4. A transfer applies both legs or neither
 *
 * Existence and duplicate-name checks run before amount text is parsed, so a call
 * with both a bad name and a bad amount reports the name problem.
 *
 * Operations are serialized on the instance.
 */
@Slf4j
public class Ledger {

    private final List<Account> accounts = new ArrayList<>();

    /**
     * Rebuilds a ledger from previously saved accounts, keeping their order.
     *
     * @throws DuplicateAccountNameException if two accounts share a name
     */
    public static Ledger restore(List<Account> saved) {
        Ledger ledger = new Ledger();
        Set<String> seen = new HashSet<>();
        for (Account account : saved) {
            if (!seen.add(account.getName())) {
                throw new DuplicateAccountNameException(account.getName());
            }
            ledger.accounts.add(account.snapshot());
        }
        return ledger;
    }

    /**
     * Opens a new account at the end of the ledger.
     *
     * @param name account name, must be non-empty and unused
     * @param amountText initial balance as decimal text
     * @return snapshot of the created account
     */
    public synchronized Account create(String name, String amountText) {
        if (name == null || name.isEmpty()) {
            throw new EmptyAccountNameException();
        }
        if (lookup(name).isPresent()) {
            throw new DuplicateAccountNameException(name);
        }

        Account account = new Account(name, Cents.parse(amountText));
        accounts.add(account);

        log.info("Account created with name {} and balance {}", account.getName(), account.getBalance());
        return account.snapshot();
    }

    /**
     * Deposits into an existing account.
     *
     * @return the account's new balance
     */
    public synchronized Cents deposit(String name, String amountText) {
        Account account = require(name);
        Cents amount = Cents.parse(amountText);

        Cents balance = account.deposit(amount);
        log.info("Deposited {} to {}, balance is now {}", amount, name, balance);
        return balance;
    }

    /**
     * Withdraws from an existing account. Withdrawing the whole balance is allowed.
     *
     * @return the account's new balance
     */
    public synchronized Cents withdraw(String name, String amountText) {
        Account account = require(name);
        Cents amount = Cents.parse(amountText);

        Cents balance = account.withdraw(amount);
        log.info("Withdrew {} from {}, balance is now {}", amount, name, balance);
        return balance;
    }

    /**
     * Moves an amount from one account to another as a single unit.
     *
     * The withdrawal is first tried against a snapshot of the source account.
     * Only after that and the real deposit succeed is the withdrawal committed
     * to the source, so a failure on either leg leaves both accounts as they were.
     *
     * @param fromName account to debit, checked for existence first
     * @param toName account to credit
     * @param amountText amount as decimal text, parsed once for both legs
     * @return both balances after the transfer
     * @throws AccountOverdraftException if the source cannot cover the amount
     * @throws com.flagship.banking_ledger.exception.BalanceOverflowException if the destination would overflow
     */
    public synchronized TransferResult transfer(String fromName, String toName, String amountText) {
        Account from = require(fromName);
        Account to = require(toName);
        Cents amount = Cents.parse(amountText);

        from.snapshot().withdraw(amount);
        to.deposit(amount);

        Cents fromBalance;
        try {
            fromBalance = from.withdraw(amount);
        } catch (AccountOverdraftException e) {
            throw new IllegalStateException(
                String.format("Transfer withdrawal from %s failed after its trial succeeded", fromName), e);
        }

        TransferResult result = new TransferResult(fromName, fromBalance, toName, to.getBalance(), amount);
        log.info("Transferred {} from {} to {}: {} balance is now {}, {} balance is now {}",
            amount, fromName, toName, fromName, result.getFromBalance(), toName, result.getToBalance());
        return result;
    }

    public synchronized Optional<Account> find(String name) {
        return lookup(name).map(Account::snapshot);
    }

    /**
     * Snapshots of all accounts in insertion order.
     */
    public synchronized List<Account> accounts() {
        List<Account> snapshots = new ArrayList<>(accounts.size());
        for (Account account : accounts) {
            snapshots.add(account.snapshot());
        }
        return List.copyOf(snapshots);
    }

    public synchronized int size() {
        return accounts.size();
    }

    private Account require(String name) {
        return lookup(name).orElseThrow(() -> new AccountNotFoundException(name));
    }

    private Optional<Account> lookup(String name) {
        return accounts.stream()
            .filter(account -> account.getName().equals(name))
            .findFirst();
    }
}
