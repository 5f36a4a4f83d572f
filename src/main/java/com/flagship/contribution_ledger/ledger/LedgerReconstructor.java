package com.flagship.contribution_ledger.ledger;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Derives stock from events. Stock is never stored: it is the left fold of an
 * item's events in (occurredAt, sequenceNumber) order, where a contribution adds
 * its quantity and a quantity change replaces the running value.
 *
 * Stateless; callers supply the events.
 */
@Component
public class LedgerReconstructor {

    public static final Comparator<LedgerEvent> REPLAY_ORDER = Comparator
        .comparing(LedgerEvent::getOccurredAt)
        .thenComparingLong(LedgerEvent::getSequenceNumber);

    /**
     * Stock of {@code key} after every supplied event. Events for other items are ignored.
     */
    public long currentStock(Collection<? extends LedgerEvent> events, ItemKey key) {
        long balance = 0;
        for (LedgerEvent event : replayOrder(events)) {
            if (key.equals(event.getItemKey())) {
                balance = apply(balance, event);
            }
        }
        return balance;
    }

    /**
     * Stock of {@code key} counting only events that occurred at or before {@code at}.
     */
    public long stockAt(Collection<? extends LedgerEvent> events, ItemKey key, Instant at) {
        long balance = 0;
        for (LedgerEvent event : replayOrder(events)) {
            if (event.getOccurredAt().isAfter(at)) {
                break;
            }
            if (key.equals(event.getItemKey())) {
                balance = apply(balance, event);
            }
        }
        return balance;
    }

    /**
     * Running balance of one item, one point per event of that item.
     */
    public List<BalancePoint> runningBalance(Collection<? extends LedgerEvent> events, ItemKey key) {
        List<BalancePoint> points = new ArrayList<>();
        long balance = 0;
        for (LedgerEvent event : replayOrder(events)) {
            if (key.equals(event.getItemKey())) {
                balance = apply(balance, event);
                points.add(new BalancePoint(event, balance));
            }
        }
        return points;
    }

    /**
     * Every event in replay order, each annotated with the balance of its own item.
     */
    public List<BalancePoint> annotate(Collection<? extends LedgerEvent> events) {
        Map<ItemKey, Long> balances = new HashMap<>();
        List<BalancePoint> points = new ArrayList<>(events.size());
        for (LedgerEvent event : replayOrder(events)) {
            long balance = apply(balances.getOrDefault(event.getItemKey(), 0L), event);
            balances.put(event.getItemKey(), balance);
            points.add(new BalancePoint(event, balance));
        }
        return points;
    }

    /**
     * Stock of every item that appears in the events, sorted by category then item name.
     * Items whose stock folds to zero are included.
     */
    public SortedMap<ItemKey, Long> stockLevels(Collection<? extends LedgerEvent> events) {
        SortedMap<ItemKey, Long> levels = new TreeMap<>();
        for (LedgerEvent event : replayOrder(events)) {
            levels.put(event.getItemKey(), apply(levels.getOrDefault(event.getItemKey(), 0L), event));
        }
        return levels;
    }

    static long apply(long balance, LedgerEvent event) {
        return switch (event.getKind()) {
            case CONTRIBUTION -> Math.addExact(balance, ((ContributionEvent) event).getQuantity());
            case QUANTITY_CHANGE -> ((QuantityChangeEvent) event).getNewQuantity();
        };
    }

    private static List<LedgerEvent> replayOrder(Collection<? extends LedgerEvent> events) {
        List<LedgerEvent> ordered = new ArrayList<>(events);
        ordered.sort(REPLAY_ORDER);
        return ordered;
    }
}
