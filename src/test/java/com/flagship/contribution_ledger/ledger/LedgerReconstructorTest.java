package com.flagship.contribution_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LedgerReconstructorTest {

    private static final long GUILD = 1L;
    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");
    private static final ItemKey ROPE = ItemKey.of("Materials", "Rope");
    private static final ItemKey IRON = ItemKey.of("Materials", "Iron");

    private final LedgerReconstructor reconstructor = new LedgerReconstructor();
    private long sequence;

    @Test
    @DisplayName("Contributions add up")
    void contributionsAdd() {
        List<LedgerEvent> events = List.of(
            contribution(ROPE, 5, 0),
            contribution(ROPE, 3, 1),
            contribution(IRON, 100, 2));

        assertEquals(8, reconstructor.currentStock(events, ROPE));
        assertEquals(100, reconstructor.currentStock(events, IRON));
        assertEquals(0, reconstructor.currentStock(events, ItemKey.of("Materials", "Cloth")));
    }

    @Test
    @DisplayName("An override replaces the running value and later contributions add on top")
    void overrideThenContribution() {
        List<LedgerEvent> events = List.of(
            contribution(ROPE, 5, 0),
            contribution(ROPE, 3, 1),
            override(ROPE, 8, 20, 2),
            contribution(ROPE, 4, 3));

        assertEquals(24, reconstructor.currentStock(events, ROPE));
    }

    @Test
    @DisplayName("Replay order comes from timestamps, not list order")
    void replayIgnoresInputOrder() {
        List<LedgerEvent> events = List.of(
            contribution(ROPE, 4, 3),
            override(ROPE, 0, 20, 2),
            contribution(ROPE, 5, 0));

        assertEquals(24, reconstructor.currentStock(events, ROPE));
    }

    @Test
    @DisplayName("Equal timestamps are ordered by sequence number")
    void tieBreakBySequence() {
        ContributionEvent contribution = contribution(ROPE, 5, 0);
        QuantityChangeEvent laterOverride = override(ROPE, 5, 1, 0);

        assertEquals(1, reconstructor.currentStock(List.of(laterOverride, contribution), ROPE));

        QuantityChangeEvent earlierOverride = override(ROPE, 0, 1, 0).toBuilder()
            .sequenceNumber(contribution.getSequenceNumber() - 1)
            .build();
        assertEquals(6, reconstructor.currentStock(List.of(contribution, earlierOverride), ROPE));
    }

    @Test
    @DisplayName("Old quantity on an override never affects the result")
    void oldQuantityIsMetadata() {
        List<LedgerEvent> events = List.of(
            contribution(ROPE, 5, 0),
            override(ROPE, 999, 2, 1));

        assertEquals(2, reconstructor.currentStock(events, ROPE));
    }

    @Test
    @DisplayName("Stock at a past instant only counts events up to that instant")
    void stockAtInstant() {
        List<LedgerEvent> events = List.of(
            contribution(ROPE, 5, 0),
            override(ROPE, 5, 20, 10),
            contribution(ROPE, 4, 20));

        assertEquals(0, reconstructor.stockAt(events, ROPE, T0.minusSeconds(1)));
        assertEquals(5, reconstructor.stockAt(events, ROPE, T0.plusSeconds(9)));
        assertEquals(20, reconstructor.stockAt(events, ROPE, T0.plusSeconds(10)));
        assertEquals(24, reconstructor.stockAt(events, ROPE, T0.plusSeconds(60)));
    }

    @Test
    @DisplayName("Running balance has one point per event of the item")
    void runningBalance() {
        List<LedgerEvent> events = List.of(
            contribution(ROPE, 5, 0),
            contribution(IRON, 7, 1),
            override(ROPE, 5, 2, 2),
            contribution(ROPE, 3, 3));

        List<BalancePoint> points = reconstructor.runningBalance(events, ROPE);

        assertEquals(List.of(5L, 2L, 5L), points.stream().map(BalancePoint::getBalance).toList());
    }

    @Test
    @DisplayName("Annotated history tracks each item's balance separately")
    void annotateAcrossItems() {
        List<LedgerEvent> events = List.of(
            contribution(ROPE, 5, 0),
            contribution(IRON, 7, 1),
            contribution(ROPE, 1, 2),
            override(IRON, 7, 0, 3));

        List<BalancePoint> points = reconstructor.annotate(events);

        assertEquals(4, points.size());
        assertEquals(List.of(5L, 7L, 6L, 0L), points.stream().map(BalancePoint::getBalance).toList());
        assertEquals(IRON, points.get(3).getItemKey());
    }

    @Test
    @DisplayName("Stock levels cover every item, sorted by category then name")
    void stockLevelsSorted() {
        ItemKey arrows = ItemKey.of("Ammo", "Arrows");
        List<LedgerEvent> events = List.of(
            contribution(ROPE, 5, 0),
            contribution(IRON, 7, 1),
            contribution(arrows, 50, 2),
            override(IRON, 7, 0, 3));

        Map<ItemKey, Long> levels = reconstructor.stockLevels(events);

        assertEquals(List.of(arrows, IRON, ROPE), List.copyOf(levels.keySet()));
        assertEquals(0L, levels.get(IRON));
        assertEquals(50L, levels.get(arrows));
    }

    @Test
    @DisplayName("No events means zero stock")
    void emptyHistory() {
        assertEquals(0, reconstructor.currentStock(List.of(), ROPE));
        assertTrue(reconstructor.stockLevels(List.of()).isEmpty());
    }

    private ContributionEvent contribution(ItemKey key, long quantity, long secondsAfterStart) {
        return ContributionEvent.builder()
            .id(++sequence)
            .sequenceNumber(sequence * 10)
            .guildId(GUILD)
            .actorId(100L)
            .category(key.getCategory())
            .itemName(key.getItemName())
            .quantity(quantity)
            .createdAt(T0.plusSeconds(secondsAfterStart))
            .build();
    }

    private QuantityChangeEvent override(ItemKey key, long oldQuantity, long newQuantity, long secondsAfterStart) {
        return QuantityChangeEvent.builder()
            .id(++sequence)
            .sequenceNumber(sequence * 10)
            .guildId(GUILD)
            .category(key.getCategory())
            .itemName(key.getItemName())
            .oldQuantity(oldQuantity)
            .newQuantity(newQuantity)
            .reason("Stock count")
            .actorId(200L)
            .changedAt(T0.plusSeconds(secondsAfterStart))
            .build();
    }
}
