package com.flagship.contribution_ledger.ledger;

import com.flagship.contribution_ledger.observability.LedgerMetrics;
import com.flagship.contribution_ledger.storage.StorageHandle;
import com.flagship.contribution_ledger.support.MutableClock;
import com.flagship.contribution_ledger.support.TestStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuantityRedistributorTest {

    private static final long GUILD = 20L;
    private static final ItemKey ROPE = ItemKey.of("Materials", "Rope");

    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private StorageHandle storage;
    private EventStore eventStore;
    private QuantityRedistributor redistributor;
    private final LedgerReconstructor reconstructor = new LedgerReconstructor();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        storage = TestStorage.newHandle(registry);
        eventStore = new EventStore(storage, clock);
        redistributor = new QuantityRedistributor(eventStore, storage, new ItemKeyLocks(), new LedgerMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    @Test
    @DisplayName("Rows are rescaled in place and a correction event is appended")
    void rescalesRows() {
        long first = contribute(5);
        long second = contribute(3);

        RedistributionResult result = redistributor.redistribute(request(10));

        assertTrue(result.isApplied());
        assertEquals(8, result.getPreviousTotal());
        assertEquals(2, result.getRowsUpdated());

        List<ContributionEvent> rows = eventStore.findContributions(GUILD, ROPE);
        assertEquals(List.of(first, second), rows.stream().map(ContributionEvent::getId).toList());
        assertEquals(List.of(6L, 4L), rows.stream().map(ContributionEvent::getQuantity).toList());

        QuantityChangeEvent correction = (QuantityChangeEvent) eventStore
            .findEvent(GUILD, EventKind.QUANTITY_CHANGE, result.getQuantityChangeEventId())
            .orElseThrow();
        assertEquals(8, correction.getOldQuantity());
        assertEquals(10, correction.getNewQuantity());
        assertEquals(RedistributionRequest.DEFAULT_REASON, correction.getReason());
        assertEquals(RedistributionRequest.SYSTEM_ACTOR_ID, correction.getActorId());

        assertEquals(10, stock());
        assertEquals(1.0, registry.get("ledger.redistributions").tag("outcome", "applied").counter().count());
    }

    @Test
    @DisplayName("Rewritten rows keep their id, sequence number and timestamp")
    void rewriteKeepsIdentity() {
        contribute(5);
        ContributionEvent before = eventStore.findContributions(GUILD, ROPE).get(0);

        redistributor.redistribute(request(9));

        ContributionEvent after = eventStore.findContributions(GUILD, ROPE).get(0);
        assertEquals(before.getId(), after.getId());
        assertEquals(before.getSequenceNumber(), after.getSequenceNumber());
        assertEquals(before.getCreatedAt(), after.getCreatedAt());
        assertEquals(9, after.getQuantity());
    }

    @Test
    @DisplayName("Replayed stock equals the target even after earlier overrides")
    void replayMatchesTargetAfterOverride() {
        contribute(5);
        eventStore.appendQuantityChange(GUILD, "Rope", "Materials", 5, 20, "Stock count", null, 2L);
        clock.advance(Duration.ofSeconds(1));
        contribute(3);
        assertEquals(23, stock());

        redistributor.redistribute(request(10));

        assertEquals(10, stock());
        assertEquals(10, eventStore.findContributions(GUILD, ROPE).stream()
            .mapToLong(ContributionEvent::getQuantity).sum());
    }

    @Test
    @DisplayName("Rows that round to zero are deleted rather than stored as zero")
    void zeroRowsDeleted() {
        contribute(1);
        contribute(1);
        contribute(1);

        RedistributionResult result = redistributor.redistribute(request(1));

        assertEquals(2, result.getRowsRemoved());
        List<ContributionEvent> rows = eventStore.findContributions(GUILD, ROPE);
        assertEquals(1, rows.size());
        assertEquals(1, rows.get(0).getQuantity());
    }

    @Test
    @DisplayName("A zero target clears every row and leaves stock at zero")
    void zeroTarget() {
        contribute(4);
        contribute(6);

        redistributor.redistribute(request(0));

        assertTrue(eventStore.findContributions(GUILD, ROPE).isEmpty());
        assertEquals(0, stock());
    }

    @Test
    @DisplayName("Without contribution rows nothing is written")
    void noRowsIsNoOp() {
        RedistributionResult result = redistributor.redistribute(request(10));

        assertFalse(result.isApplied());
        assertNull(result.getQuantityChangeEventId());
        assertTrue(eventStore.queryEvents(EventQuery.forGuild(GUILD)).isEmpty());
        assertEquals(1.0, registry.get("ledger.redistributions").tag("outcome", "skipped").counter().count());
    }

    @Test
    @DisplayName("Invalid requests are rejected before touching storage")
    void validation() {
        contribute(5);

        assertThrows(InvalidQuantityException.class, () -> redistributor.redistribute(request(-1)));
        assertThrows(MissingReasonException.class, () -> redistributor.redistribute(
            RedistributionRequest.builder().guildId(GUILD).category("Materials").itemName("Rope")
                .newTotal(3).reason(" ").build()));
        assertEquals(5, stock());
    }

    @Test
    @DisplayName("Caller-supplied reason, notes and actor end up on the correction event")
    void customAttribution() {
        contribute(5);

        RedistributionResult result = redistributor.redistribute(RedistributionRequest.builder()
            .guildId(GUILD)
            .category("Materials")
            .itemName("Rope")
            .newTotal(2)
            .reason("Lost in raid")
            .notes("Two left after the siege")
            .actorId(77L)
            .build());

        QuantityChangeEvent correction = (QuantityChangeEvent) eventStore
            .findEvent(GUILD, EventKind.QUANTITY_CHANGE, result.getQuantityChangeEventId())
            .orElseThrow();
        assertEquals("Lost in raid", correction.getReason());
        assertEquals("Two left after the siege", correction.getNotes());
        assertEquals(77L, correction.getActorId());
    }

    private long contribute(long quantity) {
        long id = eventStore.appendContribution(GUILD, 100L, "Materials", "Rope", quantity);
        clock.advance(Duration.ofSeconds(1));
        return id;
    }

    private long stock() {
        return reconstructor.currentStock(eventStore.queryEvents(EventQuery.forItem(GUILD, ROPE)), ROPE);
    }

    private static RedistributionRequest request(long newTotal) {
        return RedistributionRequest.builder()
            .guildId(GUILD)
            .category("Materials")
            .itemName("Rope")
            .newTotal(newTotal)
            .build();
    }
}
