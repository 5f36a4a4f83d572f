package com.flagship.contribution_ledger.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.contribution_ledger.ledger.ContributionEvent;
import com.flagship.contribution_ledger.ledger.EventStore;
import com.flagship.contribution_ledger.ledger.QuantityChangeEvent;
import com.flagship.contribution_ledger.observability.CorrelationContext;
import com.flagship.contribution_ledger.observability.LedgerMetrics;
import com.flagship.contribution_ledger.storage.StorageHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Closes an epoch: snapshots a guild's contributions (and recent quantity changes)
 * into an archive row, then clears the live contribution rows.
 *
 * Quantity-change events survive archiving unless
 * {@code ledger.archive.clear-quantity-changes} is set, so overrides keep
 * determining stock after the reset. Snapshot and clearing commit together.
 */
@Slf4j
@Service
public class ArchiveService {

    private static final String SUMMARY_COLUMNS =
        "id, guild_id, archive_name, description, notes, created_at, created_by_id";

    private final StorageHandle storageHandle;
    private final EventStore eventStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final boolean clearQuantityChanges;
    private final int maxQuantityChanges;

    public ArchiveService(StorageHandle storageHandle,
                          EventStore eventStore,
                          ObjectMapper objectMapper,
                          Clock clock,
                          LedgerMetrics metrics,
                          @Value("${ledger.archive.clear-quantity-changes:false}") boolean clearQuantityChanges,
                          @Value("${ledger.archive.max-quantity-changes:1000}") int maxQuantityChanges) {
        if (maxQuantityChanges < 0) {
            throw new IllegalArgumentException("ledger.archive.max-quantity-changes must not be negative");
        }
        this.storageHandle = storageHandle;
        this.eventStore = eventStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
        this.clearQuantityChanges = clearQuantityChanges;
        this.maxQuantityChanges = maxQuantityChanges;
    }

    /**
     * Archives and resets the guild's contributions.
     *
     * @return id of the new archive
     * @throws IllegalArgumentException if name or description is blank
     */
    public long archiveEpoch(long guildId, ArchiveMetadata metadata) {
        if (metadata.getName() == null || metadata.getName().isBlank()) {
            throw new IllegalArgumentException("Archive name is required");
        }
        if (metadata.getDescription() == null || metadata.getDescription().isBlank()) {
            throw new IllegalArgumentException("Archive description is required");
        }

        try (CorrelationContext.Scope ignored = CorrelationContext.forGuild(guildId)) {
            Instant archivedAt = clock.instant();

            long[] cleared = new long[2];
            long archiveId = storageHandle.inTransaction("archive-epoch", jdbc -> {
                List<ContributionEvent> contributions = eventStore.findAllContributions(guildId);
                List<QuantityChangeEvent> changes = eventStore.findQuantityChanges(guildId);

                ArchiveSnapshot snapshot = ArchiveSnapshot.builder()
                    .archivedAt(archivedAt)
                    .totalContributions(contributions.size())
                    .totalQuantityChanges(changes.size())
                    .contributions(contributions)
                    .quantityChanges(changes.subList(Math.max(0, changes.size() - maxQuantityChanges), changes.size()))
                    .quantityChangesCleared(clearQuantityChanges)
                    .build();

                jdbc.update(
                    "INSERT INTO ledger_archives " +
                    "(guild_id, archive_name, description, notes, archived_data, created_at, created_by_id) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?)",
                    guildId,
                    metadata.getName(),
                    metadata.getDescription(),
                    metadata.getNotes(),
                    serialize(snapshot),
                    archivedAt.toEpochMilli(),
                    metadata.getCreatedBy()
                );
                Long id = jdbc.queryForObject("SELECT last_insert_rowid()", Long.class);

                cleared[0] = eventStore.deleteContributions(guildId);
                if (clearQuantityChanges) {
                    cleared[1] = eventStore.deleteQuantityChanges(guildId);
                }
                return id;
            });

            metrics.recordArchiveCreated();
            log.info("Archive {} '{}' created by actor={}: cleared {} contributions and {} quantity changes",
                archiveId, metadata.getName(), metadata.getCreatedBy(), cleared[0], cleared[1]);
            return archiveId;
        }
    }

    /**
     * Archives of a guild, newest first.
     */
    public List<ArchiveSummary> listArchives(long guildId) {
        return storageHandle.execute("list-archives", jdbc -> jdbc.query(
            "SELECT " + SUMMARY_COLUMNS + " FROM ledger_archives WHERE guild_id = ? " +
            "ORDER BY created_at DESC, id DESC",
            summaryRowMapper(),
            guildId
        ));
    }

    public Optional<LedgerArchive> getArchive(long archiveId) {
        List<LedgerArchive> rows = storageHandle.execute("get-archive", jdbc -> jdbc.query(
            "SELECT " + SUMMARY_COLUMNS + ", archived_data FROM ledger_archives WHERE id = ?",
            (rs, rowNum) -> new LedgerArchive(
                summaryRowMapper().mapRow(rs, rowNum),
                deserialize(rs.getString("archived_data"))),
            archiveId
        ));
        return rows.stream().findFirst();
    }

    private RowMapper<ArchiveSummary> summaryRowMapper() {
        return (rs, rowNum) -> ArchiveSummary.builder()
            .id(rs.getLong("id"))
            .guildId(rs.getLong("guild_id"))
            .name(rs.getString("archive_name"))
            .description(rs.getString("description"))
            .notes(rs.getString("notes"))
            .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
            .createdBy(rs.getLong("created_by_id"))
            .build();
    }

    private String serialize(ArchiveSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize archive snapshot", e);
        }
    }

    private ArchiveSnapshot deserialize(String json) {
        try {
            return objectMapper.readValue(json, ArchiveSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read archive snapshot: " + e.getMessage(), e);
        }
    }
}
