package com.flagship.contribution_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Entry point for the contribution ledger service.
 *
 * The ledger owns a single SQLite connection through StorageHandle,
 * so the pooled DataSource auto-configuration is switched off.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class ContributionLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContributionLedgerApplication.class, args);
    }
}
