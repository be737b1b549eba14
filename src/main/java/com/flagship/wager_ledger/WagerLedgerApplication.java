package com.flagship.wager_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WagerLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WagerLedgerApplication.class, args);
    }
}
