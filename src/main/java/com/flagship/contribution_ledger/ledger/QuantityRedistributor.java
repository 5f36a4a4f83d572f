package com.flagship.contribution_ledger.ledger;

import com.flagship.contribution_ledger.observability.CorrelationContext;
import com.flagship.contribution_ledger.observability.LedgerMetrics;
import com.flagship.contribution_ledger.storage.StorageHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Rescales an item's contribution rows so that they sum to a target total, then
 * appends a quantity-change event recording the correction.
 *
 * This is the one place where stored events are rewritten. The rows are treated
 * as a per-contributor breakdown of the current stock; the appended correction
 * event keeps the replayed stock equal to the target regardless of what earlier
 * overrides did. Row rewrites and the correction event commit together.
 */
@Slf4j
@Service
public class QuantityRedistributor {

    private final EventStore eventStore;
    private final StorageHandle storageHandle;
    private final ItemKeyLocks itemKeyLocks;
    private final LedgerMetrics metrics;

    public QuantityRedistributor(EventStore eventStore, StorageHandle storageHandle,
                                 ItemKeyLocks itemKeyLocks, LedgerMetrics metrics) {
        this.eventStore = eventStore;
        this.storageHandle = storageHandle;
        this.itemKeyLocks = itemKeyLocks;
        this.metrics = metrics;
    }

    /**
     * @throws InvalidQuantityException if the target total is negative
     * @throws MissingReasonException if an explicit reason is blank
     */
    public RedistributionResult redistribute(RedistributionRequest request) {
        ItemKey key = request.getItemKey();
        if (request.getNewTotal() < 0) {
            throw new InvalidQuantityException("New total cannot be negative, got " + request.getNewTotal());
        }
        if (request.getReason() == null || request.getReason().isBlank()) {
            throw new MissingReasonException();
        }

        long started = System.nanoTime();
        try (CorrelationContext.Scope ignored = CorrelationContext.forItem(request.getGuildId(), key.toString())) {
            RedistributionResult result = itemKeyLocks.withLock(request.getGuildId(), key,
                () -> storageHandle.inTransaction("redistribute", jdbc -> apply(request, key)));

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            if (result.isApplied()) {
                metrics.recordRedistribution("applied", elapsed);
                metrics.recordQuantityChange("redistribution");
                log.info("Redistributed {}: {} -> {} (updated={}, removed={}, event={})",
                    key, result.getPreviousTotal(), result.getNewTotal(),
                    result.getRowsUpdated(), result.getRowsRemoved(), result.getQuantityChangeEventId());
            } else {
                metrics.recordRedistribution("skipped", elapsed);
                log.info("No contributions recorded for {}, redistribution skipped", key);
            }
            return result;
        }
    }

    private RedistributionResult apply(RedistributionRequest request, ItemKey key) {
        List<ContributionEvent> records = eventStore.findContributions(request.getGuildId(), key);
        if (records.isEmpty()) {
            return RedistributionResult.skipped(request.getGuildId(), key, request.getNewTotal());
        }

        RedistributionPlan plan = RedistributionPlan.compute(records, request.getNewTotal());
        List<RedistributionPlan.Allocation> updates = plan.getUpdates();
        List<RedistributionPlan.Allocation> removals = plan.getRemovals();

        for (RedistributionPlan.Allocation update : updates) {
            eventStore.updateContributionQuantity(update.getContributionId(), update.getNewQuantity());
        }
        for (RedistributionPlan.Allocation removal : removals) {
            eventStore.deleteEvent(EventKind.CONTRIBUTION, removal.getContributionId());
        }

        long eventId = eventStore.appendQuantityChange(
            request.getGuildId(),
            key.getItemName(),
            key.getCategory(),
            plan.getCurrentTotal(),
            plan.getNewTotal(),
            request.getReason(),
            request.getNotes(),
            request.getActorId()
        );

        return RedistributionResult.builder()
            .guildId(request.getGuildId())
            .itemKey(key)
            .applied(true)
            .previousTotal(plan.getCurrentTotal())
            .newTotal(plan.getNewTotal())
            .rowsUpdated(updates.size())
            .rowsRemoved(removals.size())
            .quantityChangeEventId(eventId)
            .build();
    }
}
