package com.open_banking_archiver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OpenBankingArchiverApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(OpenBankingArchiverApplication.class, args)));
    }
}
