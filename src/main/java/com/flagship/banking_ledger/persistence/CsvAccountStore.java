package com.flagship.banking_ledger.persistence;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.banking_ledger.ledger.Account;
import com.flagship.banking_ledger.ledger.Ledger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads and saves the whole ledger as a CSV file with a {@code name,balance} header.
 *
 * The ledger is read once at startup and written back in full; rows keep ledger order.
 * Duplicate names in the file are rejected on load rather than silently merged.
 */
@Component
@Slf4j
public class CsvAccountStore {

    private final CsvMapper csvMapper;
    private final CsvSchema schema;
    private final Path path;

    public CsvAccountStore(CsvMapper csvMapper,
                           @Value("${ledger.store.path:./banking_system.csv}") Path path) {
        this.csvMapper = csvMapper;
        this.schema = csvMapper.schemaFor(AccountRecord.class).withHeader();
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reads the ledger from disk, creating an empty store if none exists yet.
     *
     * @throws AccountStoreException if the file cannot be read or holds a malformed balance
     * @throws com.flagship.banking_ledger.exception.DuplicateAccountNameException if a name repeats
     * @throws com.flagship.banking_ledger.exception.EmptyAccountNameException if a name is empty
     */
    public Ledger load() {
        if (Files.notExists(path)) {
            try {
                Files.createFile(path);
            } catch (IOException e) {
                throw new AccountStoreException("Failed to create account store " + path, e);
            }
            log.info("Created empty account store at {}", path);
            return new Ledger();
        }

        List<Account> accounts = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<AccountRecord> rows = csvMapper.readerFor(AccountRecord.class)
                 .with(schema)
                 .readValues(reader)) {
            while (rows.hasNextValue()) {
                accounts.add(rows.nextValue().toDomain());
            }
        } catch (IOException e) {
            throw new AccountStoreException("Failed to read account store " + path, e);
        } catch (NumberFormatException e) {
            throw new AccountStoreException("Malformed balance in account store " + path, e);
        }

        Ledger ledger = Ledger.restore(accounts);
        log.info("Loaded {} accounts from {}", ledger.size(), path);
        return ledger;
    }

    /**
     * Replaces the store contents with the ledger's accounts.
     */
    public void save(Ledger ledger) {
        List<AccountRecord> records = new ArrayList<>();
        for (Account account : ledger.accounts()) {
            records.add(AccountRecord.from(account));
        }

        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             SequenceWriter rows = csvMapper.writer(schema).writeValues(out)) {
            rows.writeAll(records);
        } catch (IOException e) {
            throw new AccountStoreException("Failed to write account store " + path, e);
        }
        log.info("Saved {} accounts to {}", records.size(), path);
    }
}
