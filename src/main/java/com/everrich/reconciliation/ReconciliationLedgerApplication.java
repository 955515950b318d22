package com.everrich.reconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class ReconciliationLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconciliationLedgerApplication.class, args);
    }
}
