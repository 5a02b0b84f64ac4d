package com.mintledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MintLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MintLedgerApplication.class, args);
    }
}
