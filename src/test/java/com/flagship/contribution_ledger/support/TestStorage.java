package com.flagship.contribution_ledger.support;

import com.flagship.contribution_ledger.observability.LedgerMetrics;
import com.flagship.contribution_ledger.storage.ResilientExecutor;
import com.flagship.contribution_ledger.storage.StorageHandle;
import io.micrometer.core.instrument.MeterRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Throwaway SQLite ledger files for tests.
 */
public final class TestStorage {

    public static final String SCHEMA = "db/ledger-schema.sql";

    private TestStorage() {
    }

    public static Path newDatabaseFile() {
        try {
            return Files.createTempDirectory("ledger-test").resolve("ledger.db");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * A handle on a fresh file with three fast attempts per operation.
     */
    public static StorageHandle newHandle(MeterRegistry registry) {
        return newHandle(newDatabaseFile(), registry);
    }

    public static StorageHandle newHandle(Path databaseFile, MeterRegistry registry) {
        return new StorageHandle(
            databaseFile.toString(),
            1000,
            SCHEMA,
            new ResilientExecutor(3, 1, 2.0, 10),
            new LedgerMetrics(registry));
    }
}
