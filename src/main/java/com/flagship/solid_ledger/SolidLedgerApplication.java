package com.flagship.solid_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SolidLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SolidLedgerApplication.class, args);
    }
}
