package com.penny.ledger;

import com.penny.ledger.config.PennyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PennyProperties.class)
public class PennyLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PennyLedgerApplication.class, args);
    }
}
