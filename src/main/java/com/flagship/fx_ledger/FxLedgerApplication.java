package com.flagship.fx_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.flagship.fx_ledger.config")
public class FxLedgerApplication {
    public static void main(String[] args) {
        SpringApplication.run(FxLedgerApplication.class, args);
    }
}
