package com.flagship.banking_ledger.persistence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.banking_ledger.currency.Cents;
import com.flagship.banking_ledger.ledger.Account;
import lombok.Value;

/**
 * One CSV row of the account store.
 *
 * The balance is kept as the unsigned minor-unit count in text form so that
 * balances above {@link Long#MAX_VALUE} survive the file.
 */
@Value
@JsonPropertyOrder({"name", "balance"})
public class AccountRecord {

    @JsonProperty("name")
    String name;

    @JsonProperty("balance")
    String balance;

    @JsonCreator
    public AccountRecord(@JsonProperty("name") String name, @JsonProperty("balance") String balance) {
        this.name = name;
        this.balance = balance;
    }

    public static AccountRecord from(Account account) {
        return new AccountRecord(account.getName(), account.getBalance().minorUnitsAsString());
    }

    /**
     * @throws NumberFormatException if the balance column is not an unsigned 64-bit integer
     */
    public Account toDomain() {
        return new Account(name, Cents.ofMinorUnits(balance));
    }
}
