package com.flagship.accounting_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AccountingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountingLedgerApplication.class, args);
    }
}
