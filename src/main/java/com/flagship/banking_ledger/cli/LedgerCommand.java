package com.flagship.banking_ledger.cli;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Commands accepted on the command line, with the options each one requires.
 */
public enum LedgerCommand {
    SHOW("Show all accounts", List.of(), false),
    CREATE("Create account", List.of("name", "amount"), true),
    DEPOSIT("Deposit amount to account", List.of("name", "amount"), true),
    WITHDRAW("Withdraw amount from account", List.of("name", "amount"), true),
    TRANSFER("Transfer amount between accounts", List.of("from", "to", "amount"), true);

    private final String description;
    private final List<String> requiredOptions;
    private final boolean mutating;

    LedgerCommand(String description, List<String> requiredOptions, boolean mutating) {
        this.description = description;
        this.requiredOptions = requiredOptions;
        this.mutating = mutating;
    }

    public static Optional<LedgerCommand> fromName(String name) {
        return Arrays.stream(values())
            .filter(command -> command.commandName().equals(name))
            .findFirst();
    }

    public String commandName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDescription() {
        return description;
    }

    public List<String> getRequiredOptions() {
        return requiredOptions;
    }

    /**
     * Whether a successful run changes the ledger and must be saved.
     */
    public boolean isMutating() {
        return mutating;
    }
}
