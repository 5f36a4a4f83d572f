package com.flagship.contribution_ledger.observability;

import com.flagship.contribution_ledger.storage.StorageHandle;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the shared ledger store connection.
 * DOWN when a trivial query cannot run on the connection.
 */
@Component("ledgerStorage")
public class LedgerStorageHealthIndicator implements HealthIndicator {

    private final StorageHandle storageHandle;

    public LedgerStorageHealthIndicator(StorageHandle storageHandle) {
        this.storageHandle = storageHandle;
    }

    @Override
    public Health health() {
        Health.Builder builder = storageHandle.isHealthy() ? Health.up() : Health.down();
        return builder
                .withDetail("database", storageHandle.getDatabasePath().toString())
                .build();
    }
}
