package com.flagship.contribution_ledger.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.contribution_ledger.ledger.ContributionEvent;
import com.flagship.contribution_ledger.ledger.EventKind;
import com.flagship.contribution_ledger.ledger.EventQuery;
import com.flagship.contribution_ledger.ledger.EventStore;
import com.flagship.contribution_ledger.ledger.LedgerService;
import com.flagship.contribution_ledger.observability.LedgerMetrics;
import com.flagship.contribution_ledger.storage.StorageHandle;
import com.flagship.contribution_ledger.support.TestStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Archiving closes an epoch: the snapshot must hold what was live, and the live
 * ledger must restart from the retained overrides only.
 */
@SpringBootTest
class ArchiveServiceTest {

    private static final Path DATABASE = TestStorage.newDatabaseFile();

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("ledger.storage.path", DATABASE::toString);
        registry.add("ledger.storage.retry.initial-delay-ms", () -> "5");
        registry.add("ledger.archive.max-quantity-changes", () -> "2");
    }

    @Autowired
    private ArchiveService archiveService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private EventStore eventStore;

    @Autowired
    private StorageHandle storageHandle;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private Clock clock;

    @Autowired
    private LedgerMetrics metrics;

    private long guildId;

    @BeforeEach
    void setUp() {
        guildId = ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE);
    }

    @Test
    @DisplayName("Archiving snapshots contributions and clears them from the live ledger")
    void archiveSnapshotsAndClears() {
        ledgerService.addContribution(guildId, 1L, "Materials", "Rope", 5);
        ledgerService.addContribution(guildId, 2L, "Ammo", "Arrows", 40);
        List<ContributionEvent> live = eventStore.findAllContributions(guildId);

        long archiveId = archiveService.archiveEpoch(guildId, metadata("Season 1"));

        LedgerArchive archive = archiveService.getArchive(archiveId).orElseThrow();
        ArchiveSnapshot snapshot = archive.getSnapshot();
        assertEquals("Season 1", archive.getSummary().getName());
        assertEquals(guildId, archive.getSummary().getGuildId());
        assertEquals(2, snapshot.getTotalContributions());
        assertEquals(live, snapshot.getContributions());
        assertFalse(snapshot.isQuantityChangesCleared());

        assertTrue(eventStore.findAllContributions(guildId).isEmpty());
        assertEquals(0, ledgerService.currentStock(guildId, "Rope", "Materials"));
    }

    @Test
    @DisplayName("Overrides survive archiving and keep determining stock")
    void overridesSurviveByDefault() {
        ledgerService.addContribution(guildId, 1L, "Materials", "Rope", 5);
        ledgerService.recordQuantityOverride(guildId, "Rope", "Materials", 12, "Stock count", null, 1L);

        archiveService.archiveEpoch(guildId, metadata("Season 1"));

        assertEquals(12, ledgerService.currentStock(guildId, "Rope", "Materials"));
        assertEquals(1, ledgerService.auditTrail(EventQuery.forGuild(guildId)).size());
        assertEquals(EventKind.QUANTITY_CHANGE,
            ledgerService.auditTrail(EventQuery.forGuild(guildId)).get(0).getKind());
    }

    @Test
    @DisplayName("The snapshot keeps only the most recent quantity changes but counts all of them")
    void snapshotCapsQuantityChanges() {
        ledgerService.addContribution(guildId, 1L, "Materials", "Rope", 5);
        for (long quantity = 1; quantity <= 3; quantity++) {
            ledgerService.recordQuantityOverride(guildId, "Rope", "Materials", quantity, "Recount", null, 1L);
        }

        long archiveId = archiveService.archiveEpoch(guildId, metadata("Capped"));

        ArchiveSnapshot snapshot = archiveService.getArchive(archiveId).orElseThrow().getSnapshot();
        assertEquals(3, snapshot.getTotalQuantityChanges());
        assertEquals(List.of(2L, 3L), snapshot.getQuantityChanges().stream()
            .map(change -> change.getNewQuantity())
            .toList());
    }

    @Test
    @DisplayName("When configured, archiving also clears the quantity-change log")
    void clearQuantityChangesWhenConfigured() {
        ArchiveService clearingService = new ArchiveService(
            storageHandle, eventStore, objectMapper, clock, metrics, true, 1000);
        ledgerService.addContribution(guildId, 1L, "Materials", "Rope", 5);
        ledgerService.recordQuantityOverride(guildId, "Rope", "Materials", 12, "Stock count", null, 1L);

        long archiveId = clearingService.archiveEpoch(guildId, metadata("Full reset"));

        assertTrue(ledgerService.auditTrail(EventQuery.forGuild(guildId)).isEmpty());
        assertEquals(0, ledgerService.currentStock(guildId, "Rope", "Materials"));
        ArchiveSnapshot snapshot = clearingService.getArchive(archiveId).orElseThrow().getSnapshot();
        assertTrue(snapshot.isQuantityChangesCleared());
        assertEquals(1, snapshot.getQuantityChanges().size());
    }

    @Test
    @DisplayName("Archives are listed newest first and scoped to their guild")
    void listArchives() {
        long first = archiveService.archiveEpoch(guildId, metadata("Season 1"));
        long second = archiveService.archiveEpoch(guildId, metadata("Season 2"));
        archiveService.archiveEpoch(guildId + 1, metadata("Elsewhere"));

        List<ArchiveSummary> archives = archiveService.listArchives(guildId);

        assertEquals(List.of(second, first), archives.stream().map(ArchiveSummary::getId).toList());
        assertTrue(archiveService.getArchive(Long.MAX_VALUE).isEmpty());
    }

    @Test
    @DisplayName("Archives need a name and a description")
    void metadataValidation() {
        assertThrows(IllegalArgumentException.class, () -> archiveService.archiveEpoch(guildId,
            ArchiveMetadata.builder().name(" ").description("d").createdBy(1L).build()));
        assertThrows(IllegalArgumentException.class, () -> archiveService.archiveEpoch(guildId,
            ArchiveMetadata.builder().name("n").description(null).createdBy(1L).build()));
        assertTrue(archiveService.listArchives(guildId).isEmpty());
    }

    private static ArchiveMetadata metadata(String name) {
        return ArchiveMetadata.builder()
            .name(name)
            .description("End of " + name)
            .notes("archived by the quartermaster")
            .createdBy(7L)
            .build();
    }
}
