package com.flagship.contribution_ledger.ledger;

import com.flagship.contribution_ledger.observability.CorrelationContext;
import com.flagship.contribution_ledger.observability.LedgerMetrics;
import com.flagship.contribution_ledger.storage.StorageHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for everything callers do with the ledger: record contributions and
 * overrides, redistribute and adjust stock, and read stock and history back.
 *
 * Stock is always derived by replaying events through {@link LedgerReconstructor};
 * nothing here stores a balance. Operations that read stock and then write an event
 * hold the item lock and run in one transaction.
 */
@Slf4j
@Service
public class LedgerService {

    private final EventStore eventStore;
    private final LedgerReconstructor reconstructor;
    private final QuantityRedistributor redistributor;
    private final ItemKeyLocks itemKeyLocks;
    private final StorageHandle storageHandle;
    private final LedgerMetrics metrics;

    public LedgerService(EventStore eventStore,
                         LedgerReconstructor reconstructor,
                         QuantityRedistributor redistributor,
                         ItemKeyLocks itemKeyLocks,
                         StorageHandle storageHandle,
                         LedgerMetrics metrics) {
        this.eventStore = eventStore;
        this.reconstructor = reconstructor;
        this.redistributor = redistributor;
        this.itemKeyLocks = itemKeyLocks;
        this.storageHandle = storageHandle;
        this.metrics = metrics;
    }

    /**
     * Records a donation.
     *
     * @return id of the new contribution
     * @throws InvalidQuantityException if quantity is not positive
     */
    public long addContribution(long guildId, long actorId, String category, String itemName, long quantity) {
        ItemKey key = ItemKey.of(category, itemName);
        try (CorrelationContext.Scope ignored = CorrelationContext.forItem(guildId, key.toString())) {
            long id = itemKeyLocks.withLock(guildId, key,
                () -> eventStore.appendContribution(guildId, actorId, category, itemName, quantity));
            metrics.recordContribution();
            log.info("Contribution {} recorded: actor={} quantity={}", id, actorId, quantity);
            return id;
        }
    }

    /**
     * Sets the stock of an item to {@code newQuantity} from now on. Earlier
     * contributions stay in history; later ones add on top of the new value.
     *
     * @return id of the new quantity-change event
     * @throws InvalidQuantityException if newQuantity is negative
     * @throws MissingReasonException if reason is blank
     */
    public long recordQuantityOverride(long guildId, String itemName, String category, long newQuantity,
                                       String reason, String notes, long actorId) {
        ItemKey key = ItemKey.of(category, itemName);
        if (newQuantity < 0) {
            throw new InvalidQuantityException("New quantity cannot be negative, got " + newQuantity);
        }
        if (reason == null || reason.isBlank()) {
            throw new MissingReasonException();
        }

        try (CorrelationContext.Scope ignored = CorrelationContext.forItem(guildId, key.toString())) {
            long id = itemKeyLocks.withLock(guildId, key, () -> storageHandle.inTransaction("record-override", jdbc -> {
                long oldQuantity = stockOf(guildId, key);
                return eventStore.appendQuantityChange(
                    guildId, itemName, category, oldQuantity, newQuantity, reason, notes, actorId);
            }));
            metrics.recordQuantityChange("override");
            log.info("Quantity override {} recorded: new quantity={} by actor={}", id, newQuantity, actorId);
            return id;
        }
    }

    /**
     * Rescales the item's contribution rows to {@code newTotal} as a system correction.
     */
    public RedistributionResult redistribute(long guildId, String itemName, String category, long newTotal) {
        return redistributor.redistribute(RedistributionRequest.builder()
            .guildId(guildId)
            .itemName(itemName)
            .category(category)
            .newTotal(newTotal)
            .build());
    }

    public RedistributionResult redistribute(RedistributionRequest request) {
        return redistributor.redistribute(request);
    }

    /**
     * Applies a SET, ADD or REMOVE to the current stock. Contribution rows are
     * rescaled to the target when the item has any; otherwise a plain quantity
     * change records the target.
     *
     * @throws InvalidQuantityException if amount is negative
     * @throws MissingReasonException if reason is blank
     */
    public AdjustmentResult adjustInventory(AdjustmentRequest request) {
        ItemKey key = request.getItemKey();
        if (request.getOperation() == null) {
            throw new IllegalArgumentException("Adjustment operation is required");
        }
        if (request.getAmount() < 0) {
            throw new InvalidQuantityException("Adjustment amount cannot be negative, got " + request.getAmount());
        }
        if (request.getReason() == null || request.getReason().isBlank()) {
            throw new MissingReasonException();
        }

        long guildId = request.getGuildId();
        AdjustmentOperation operation = request.getOperation();
        try (CorrelationContext.Scope ignored = CorrelationContext.forItem(guildId, key.toString())) {
            AdjustmentResult result = itemKeyLocks.withLock(guildId, key,
                () -> storageHandle.inTransaction("adjust-inventory", jdbc -> {
                    long current = stockOf(guildId, key);
                    long target = operation.target(current, request.getAmount());
                    String reason = operation.tagReason(request.getReason());
                    String notes = "Operation: " + operation.describe(current, request.getAmount());
                    if (request.getNotes() != null && !request.getNotes().isBlank()) {
                        notes += "\nNotes: " + request.getNotes();
                    }

                    RedistributionResult redistribution = redistributor.redistribute(RedistributionRequest.builder()
                        .guildId(guildId)
                        .category(key.getCategory())
                        .itemName(key.getItemName())
                        .newTotal(target)
                        .reason(reason)
                        .notes(notes)
                        .actorId(request.getActorId())
                        .build());

                    long eventId;
                    if (redistribution.isApplied()) {
                        eventId = redistribution.getQuantityChangeEventId();
                    } else {
                        eventId = eventStore.appendQuantityChange(guildId, key.getItemName(), key.getCategory(),
                            current, target, reason, notes, request.getActorId());
                        metrics.recordQuantityChange("adjustment");
                    }

                    return AdjustmentResult.builder()
                        .itemKey(key)
                        .operation(operation)
                        .previousStock(current)
                        .newStock(target)
                        .quantityChangeEventId(eventId)
                        .redistribution(redistribution.isApplied() ? redistribution : null)
                        .build();
                }));

            log.info("Inventory adjusted with {}: {} -> {} by actor={}",
                operation, result.getPreviousStock(), result.getNewStock(), request.getActorId());
            return result;
        }
    }

    /**
     * Replayed stock of one item.
     */
    public long currentStock(long guildId, String itemName, String category) {
        return stockOf(guildId, ItemKey.of(category, itemName));
    }

    /**
     * Stock of one item as it stood at {@code at}.
     */
    public long stockAt(long guildId, String itemName, String category, Instant at) {
        ItemKey key = ItemKey.of(category, itemName);
        return reconstructor.stockAt(eventStore.queryEvents(EventQuery.forItem(guildId, key)), key, at);
    }

    /**
     * Stock of every item the guild has events for, by category then item name.
     */
    public List<InventoryLevel> inventorySummary(long guildId) {
        Map<ItemKey, Long> levels = reconstructor.stockLevels(eventStore.queryEvents(EventQuery.forGuild(guildId)));
        List<InventoryLevel> summary = new ArrayList<>(levels.size());
        levels.forEach((key, quantity) -> summary.add(
            new InventoryLevel(key.getCategory(), key.getItemName(), quantity)));
        return summary;
    }

    /**
     * Merged history in replay order, optionally filtered and limited to the most recent events.
     */
    public List<LedgerEvent> auditTrail(EventQuery query) {
        return eventStore.queryEvents(query);
    }

    public List<LedgerEvent> auditTrail(long guildId, String itemName, String category, Integer limit) {
        return auditTrail(EventQuery.builder()
            .guildId(guildId)
            .itemName(itemName)
            .category(category)
            .limit(limit)
            .build());
    }

    /**
     * History of the matching events, each with the stock of its item after it applied.
     * Balances are computed over the item's full history even when filtering by category only.
     */
    public List<BalancePoint> auditTrailWithBalances(long guildId, String itemName, String category) {
        return reconstructor.annotate(eventStore.queryEvents(EventQuery.builder()
            .guildId(guildId)
            .itemName(itemName)
            .category(category)
            .build()));
    }

    public Optional<LedgerEvent> findEvent(long guildId, EventKind kind, long id) {
        return eventStore.findEvent(guildId, kind, id);
    }

    /**
     * Deletes one event. Replayed stock changes accordingly.
     *
     * @return false if the event did not exist
     */
    public boolean removeEvent(EventKind kind, long id) {
        boolean removed = eventStore.deleteEvent(kind, id);
        if (removed) {
            metrics.recordEventRemoved(kind.getWireName());
            log.warn("Removed {} event {}", kind.getWireName(), id);
        } else {
            log.info("No {} event {} to remove", kind.getWireName(), id);
        }
        return removed;
    }

    /**
     * Removes several events of one guild in a single transaction. References that
     * match nothing are reported, not fatal.
     */
    public BulkRemovalResult bulkRemoveEvents(long guildId, List<EventReference> references, long removedBy) {
        try (CorrelationContext.Scope ignored = CorrelationContext.forGuild(guildId)) {
            BulkRemovalResult result = storageHandle.inTransaction("bulk-remove-events", jdbc -> {
                int contributions = 0;
                int quantityChanges = 0;
                List<String> failures = new ArrayList<>();
                for (EventReference reference : references) {
                    if (!eventStore.deleteEvent(guildId, reference.getKind(), reference.getId())) {
                        failures.add(reference.getKind().getWireName() + " #" + reference.getId() + " not found");
                    } else if (reference.getKind() == EventKind.CONTRIBUTION) {
                        contributions++;
                    } else {
                        quantityChanges++;
                    }
                }
                return new BulkRemovalResult(contributions, quantityChanges, List.copyOf(failures));
            });

            for (int i = 0; i < result.getContributionsRemoved(); i++) {
                metrics.recordEventRemoved(EventKind.CONTRIBUTION.getWireName());
            }
            for (int i = 0; i < result.getQuantityChangesRemoved(); i++) {
                metrics.recordEventRemoved(EventKind.QUANTITY_CHANGE.getWireName());
            }
            log.warn("Bulk removal by actor={}: {} contributions, {} quantity changes, {} failures",
                removedBy, result.getContributionsRemoved(), result.getQuantityChangesRemoved(),
                result.getFailures().size());
            return result;
        }
    }

    public ContributionStatistics contributionStatistics(long guildId) {
        return ContributionStatistics.of(eventStore.findAllContributions(guildId));
    }

    private long stockOf(long guildId, ItemKey key) {
        return reconstructor.currentStock(eventStore.queryEvents(EventQuery.forItem(guildId, key)), key);
    }
}
