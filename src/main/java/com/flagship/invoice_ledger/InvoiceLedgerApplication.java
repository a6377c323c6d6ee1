package com.flagship.invoice_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InvoiceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceLedgerApplication.class, args);
    }
}
