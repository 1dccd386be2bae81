package com.flagship.banking_ledger.cli;

import com.flagship.banking_ledger.currency.Cents;
import com.flagship.banking_ledger.exception.LedgerException;
import com.flagship.banking_ledger.ledger.Account;
import com.flagship.banking_ledger.ledger.Ledger;
import com.flagship.banking_ledger.ledger.TransferResult;
import com.flagship.banking_ledger.persistence.CsvAccountStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Command-line entry point for the ledger.
 *
 * Usage: {@code <command> [--option=value ...]}, e.g.
 * {@code transfer --from=alice --to=bob --amount=12.50}.
 *
 * Each run loads the ledger from the store, applies one command and, if the
 * command changed the ledger, saves it back. A rejected command is reported
 * and nothing is written.
 */
@Component
@Slf4j
public class LedgerCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_USAGE = 2;

    private static final String COMMAND_MDC_KEY = "command";

    private final CsvAccountStore store;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public LedgerCommandRunner(CsvAccountStore store) {
        this(store, System.out, System.err);
    }

    LedgerCommandRunner(CsvAccountStore store, PrintStream out, PrintStream err) {
        this.store = store;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            err.println("Error: no command given");
            printUsage();
            return EXIT_USAGE;
        }

        Optional<LedgerCommand> parsed = LedgerCommand.fromName(positional.get(0));
        if (parsed.isEmpty()) {
            err.println("Error: unknown command " + positional.get(0));
            printUsage();
            return EXIT_USAGE;
        }

        LedgerCommand command = parsed.get();
        List<String> missing = command.getRequiredOptions().stream()
            .filter(option -> !args.containsOption(option))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            err.println("Error: " + command.commandName() + " requires --" + String.join(", --", missing));
            printUsage();
            return EXIT_USAGE;
        }

        MDC.put(COMMAND_MDC_KEY, command.commandName());
        try {
            Ledger ledger = store.load();
            dispatch(command, args, ledger);
            if (command.isMutating()) {
                store.save(ledger);
            }
            return EXIT_OK;
        } catch (LedgerException e) {
            log.warn("Command rejected: code={}, message={}", e.getErrorCode(), e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_REJECTED;
        } catch (RuntimeException e) {
            log.error("Command failed unexpectedly", e);
            throw e;
        } finally {
            MDC.remove(COMMAND_MDC_KEY);
        }
    }

    private void dispatch(LedgerCommand command, ApplicationArguments args, Ledger ledger) {
        switch (command) {
            case SHOW -> ledger.accounts().forEach(out::println);
            case CREATE -> {
                Account account = ledger.create(option(args, "name"), option(args, "amount"));
                out.println("Account created with name " + account.getName()
                    + " and balance " + account.getBalance());
            }
            case DEPOSIT -> printBalance(ledger.deposit(option(args, "name"), option(args, "amount")));
            case WITHDRAW -> printBalance(ledger.withdraw(option(args, "name"), option(args, "amount")));
            case TRANSFER -> {
                TransferResult result = ledger.transfer(
                    option(args, "from"), option(args, "to"), option(args, "amount"));
                out.println(result.getFromName() + " balance is now " + result.getFromBalance() + ", "
                    + result.getToName() + " balance is now " + result.getToBalance());
            }
        }
    }

    private void printBalance(Cents balance) {
        out.println("Account balance is now " + balance);
    }

    // "--name" without a value reads as an empty string
    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? "" : values.get(0);
    }

    private void printUsage() {
        err.println("Usage: banking-ledger <command> [--option=value ...]");
        err.println("Commands:");
        for (LedgerCommand command : LedgerCommand.values()) {
            String options = command.getRequiredOptions().stream()
                .map(option -> "--" + option + "=<" + option + ">")
                .collect(Collectors.joining(" "));
            err.printf("  %-10s %-45s %s%n", command.commandName(), options, command.getDescription());
        }
    }
}
