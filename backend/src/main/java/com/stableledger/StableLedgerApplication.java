package com.stableledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StableLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StableLedgerApplication.class, args);
    }
}
