package com.flagship.banking_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BankingLedgerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(BankingLedgerApplication.class, args)));
    }
}
