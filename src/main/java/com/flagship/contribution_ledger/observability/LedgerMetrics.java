package com.flagship.contribution_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.contributions.recorded: Counter of appended contributions
 * - ledger.quantity_changes.recorded: Counter of quantity change events, tagged by source
 * - ledger.redistributions: Counter of redistribution requests, tagged by outcome
 * - ledger.events.removed: Counter of administratively removed events, tagged by kind
 * - ledger.archives.created: Counter of archive epochs
 * - ledger.storage.retries / ledger.storage.unavailable: storage resilience counters
 * - ledger.redistribution.duration: Timer for redistribution runs
 *
 * Item names and guild ids are never used as tags (unbounded cardinality).
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter contributionsRecorded;
    private final Counter archivesCreated;
    private final Counter storageRetries;
    private final Counter storageUnavailable;
    private final Timer redistributionTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.contributionsRecorded = Counter.builder("ledger.contributions.recorded")
                .description("Number of contribution events appended")
                .register(registry);

        this.archivesCreated = Counter.builder("ledger.archives.created")
                .description("Number of ledger epochs archived")
                .register(registry);

        this.storageRetries = Counter.builder("ledger.storage.retries")
                .description("Storage attempts retried after a transient failure")
                .register(registry);

        this.storageUnavailable = Counter.builder("ledger.storage.unavailable")
                .description("Storage operations abandoned after retries")
                .register(registry);

        this.redistributionTimer = Timer.builder("ledger.redistribution.duration")
                .description("Time taken to redistribute an item total")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordContribution() {
        contributionsRecorded.increment();
    }

    /**
     * @param source override, redistribution or adjustment
     */
    public void recordQuantityChange(String source) {
        registry.counter("ledger.quantity_changes.recorded", "source", source).increment();
    }

    /**
     * @param outcome applied or skipped
     */
    public void recordRedistribution(String outcome, Duration duration) {
        registry.counter("ledger.redistributions", "outcome", outcome).increment();
        redistributionTimer.record(duration);
    }

    public void recordEventRemoved(String kind) {
        registry.counter("ledger.events.removed", "kind", kind).increment();
    }

    public void recordArchiveCreated() {
        archivesCreated.increment();
    }

    public void recordStorageRetry() {
        storageRetries.increment();
    }

    public void recordStorageUnavailable() {
        storageUnavailable.increment();
    }
}
