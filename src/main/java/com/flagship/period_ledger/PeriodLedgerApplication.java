package com.flagship.period_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PeriodLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeriodLedgerApplication.class, args);
    }
}
