package com.flagship.contribution_ledger.ledger;

import com.flagship.contribution_ledger.storage.StorageHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for contribution and quantity-change events.
 *
 * Every append draws a ledger-wide sequence number in the same transaction as the
 * insert, so events from both tables have one total order even when their
 * timestamps collide. Reads go through {@link StorageHandle#execute} and are
 * retried on transient failures; writes run in an exclusive transaction. When
 * called inside an outer {@link StorageHandle#inTransaction} block, every method
 * joins that transaction.
 */
@Slf4j
@Repository
public class EventStore {

    private static final String CONTRIBUTION_COLUMNS =
        "id, sequence_number, guild_id, actor_id, category, item_name, quantity, created_at";

    private static final String QUANTITY_CHANGE_COLUMNS =
        "id, sequence_number, guild_id, item_name, category, old_quantity, new_quantity, " +
        "reason, notes, actor_id, changed_at";

    private static final String UNION_SELECT =
        "SELECT 'contribution' AS event_kind, id, sequence_number, guild_id, actor_id, category, " +
        "item_name, quantity, NULL AS old_quantity, NULL AS new_quantity, NULL AS reason, " +
        "NULL AS notes, created_at AS occurred_at " +
        "FROM contribution_events WHERE guild_id = ?%1$s " +
        "UNION ALL " +
        "SELECT 'quantity_change' AS event_kind, id, sequence_number, guild_id, actor_id, category, " +
        "item_name, NULL AS quantity, old_quantity, new_quantity, reason, notes, " +
        "changed_at AS occurred_at " +
        "FROM quantity_change_events WHERE guild_id = ?%1$s ";

    private final StorageHandle storageHandle;
    private final Clock clock;

    public EventStore(StorageHandle storageHandle, Clock clock) {
        this.storageHandle = storageHandle;
        this.clock = clock;
    }

    /**
     * Appends a contribution stamped with the current time.
     *
     * @return the new contribution's id
     * @throws InvalidQuantityException if quantity is not positive
     */
    public long appendContribution(long guildId, long actorId, String category, String itemName, long quantity) {
        ItemKey.of(category, itemName);
        if (quantity <= 0) {
            throw new InvalidQuantityException("Contribution quantity must be positive, got " + quantity);
        }
        long createdAt = clock.millis();

        long id = storageHandle.inTransaction("append-contribution", jdbc -> {
            long sequence = nextSequence(jdbc);
            jdbc.update(
                "INSERT INTO contribution_events " +
                "(sequence_number, guild_id, actor_id, category, item_name, quantity, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)",
                sequence, guildId, actorId, category, itemName, quantity, createdAt
            );
            return lastInsertId(jdbc);
        });

        log.debug("Appended contribution {} for {}::{} quantity={}", id, category, itemName, quantity);
        return id;
    }

    /**
     * Appends a quantity-change event stamped with the current time.
     *
     * @return the new event's id
     * @throws InvalidQuantityException if newQuantity is negative
     * @throws MissingReasonException if reason is blank
     */
    public long appendQuantityChange(long guildId, String itemName, String category, long oldQuantity,
                                     long newQuantity, String reason, String notes, long actorId) {
        ItemKey.of(category, itemName);
        if (newQuantity < 0) {
            throw new InvalidQuantityException("New quantity cannot be negative, got " + newQuantity);
        }
        if (reason == null || reason.isBlank()) {
            throw new MissingReasonException();
        }
        long changedAt = clock.millis();

        long id = storageHandle.inTransaction("append-quantity-change", jdbc -> {
            long sequence = nextSequence(jdbc);
            jdbc.update(
                "INSERT INTO quantity_change_events " +
                "(sequence_number, guild_id, item_name, category, old_quantity, new_quantity, " +
                "reason, notes, actor_id, changed_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                sequence, guildId, itemName, category, oldQuantity, newQuantity,
                reason, notes, actorId, changedAt
            );
            return lastInsertId(jdbc);
        });

        log.debug("Appended quantity change {} for {}::{} {} -> {}", id, category, itemName, oldQuantity, newQuantity);
        return id;
    }

    /**
     * Merged history of both tables in replay order: (occurredAt, sequenceNumber)
     * ascending. With a limit, the most recent {@code limit} events are returned,
     * still in ascending order.
     */
    public List<LedgerEvent> queryEvents(EventQuery query) {
        StringBuilder filter = new StringBuilder();
        List<Object> partArgs = new ArrayList<>();
        partArgs.add(query.getGuildId());
        if (query.getItemName() != null) {
            filter.append(" AND item_name = ?");
            partArgs.add(query.getItemName());
        }
        if (query.getCategory() != null) {
            filter.append(" AND category = ?");
            partArgs.add(query.getCategory());
        }

        List<Object> args = new ArrayList<>(partArgs);
        args.addAll(partArgs);

        String sql = String.format(UNION_SELECT, filter);
        if (query.hasLimit()) {
            sql += "ORDER BY occurred_at DESC, sequence_number DESC LIMIT ?";
            args.add(query.getLimit());
        } else {
            sql += "ORDER BY occurred_at ASC, sequence_number ASC";
        }

        String finalSql = sql;
        List<LedgerEvent> events = storageHandle.execute("query-events",
            jdbc -> jdbc.query(finalSql, ledgerEventRowMapper(), args.toArray()));

        if (query.hasLimit()) {
            List<LedgerEvent> ascending = new ArrayList<>(events);
            Collections.reverse(ascending);
            return ascending;
        }
        return events;
    }

    /**
     * Contribution rows for one item, oldest first.
     */
    public List<ContributionEvent> findContributions(long guildId, ItemKey key) {
        return storageHandle.execute("find-contributions", jdbc -> jdbc.query(
            "SELECT " + CONTRIBUTION_COLUMNS + " FROM contribution_events " +
            "WHERE guild_id = ? AND category = ? AND item_name = ? " +
            "ORDER BY created_at ASC, sequence_number ASC",
            contributionRowMapper(),
            guildId, key.getCategory(), key.getItemName()
        ));
    }

    /**
     * Every contribution row of a guild, oldest first.
     */
    public List<ContributionEvent> findAllContributions(long guildId) {
        return storageHandle.execute("find-all-contributions", jdbc -> jdbc.query(
            "SELECT " + CONTRIBUTION_COLUMNS + " FROM contribution_events " +
            "WHERE guild_id = ? ORDER BY created_at ASC, sequence_number ASC",
            contributionRowMapper(),
            guildId
        ));
    }

    /**
     * Every quantity-change row of a guild, oldest first.
     */
    public List<QuantityChangeEvent> findQuantityChanges(long guildId) {
        return storageHandle.execute("find-quantity-changes", jdbc -> jdbc.query(
            "SELECT " + QUANTITY_CHANGE_COLUMNS + " FROM quantity_change_events " +
            "WHERE guild_id = ? ORDER BY changed_at ASC, sequence_number ASC",
            quantityChangeRowMapper(),
            guildId
        ));
    }

    public Optional<LedgerEvent> findEvent(long guildId, EventKind kind, long id) {
        List<LedgerEvent> rows = storageHandle.execute("find-event", jdbc -> switch (kind) {
            case CONTRIBUTION -> new ArrayList<LedgerEvent>(jdbc.query(
                "SELECT " + CONTRIBUTION_COLUMNS + " FROM contribution_events WHERE guild_id = ? AND id = ?",
                contributionRowMapper(), guildId, id));
            case QUANTITY_CHANGE -> new ArrayList<LedgerEvent>(jdbc.query(
                "SELECT " + QUANTITY_CHANGE_COLUMNS + " FROM quantity_change_events WHERE guild_id = ? AND id = ?",
                quantityChangeRowMapper(), guildId, id));
        });
        return rows.stream().findFirst();
    }

    /**
     * Deletes one event by kind and id.
     *
     * @return false if no such event existed
     */
    public boolean deleteEvent(EventKind kind, long id) {
        String sql = switch (kind) {
            case CONTRIBUTION -> "DELETE FROM contribution_events WHERE id = ?";
            case QUANTITY_CHANGE -> "DELETE FROM quantity_change_events WHERE id = ?";
        };
        int deleted = storageHandle.inTransaction("delete-event", jdbc -> jdbc.update(sql, id));
        return deleted > 0;
    }

    /**
     * Deletes one event only if it belongs to {@code guildId}.
     *
     * @return false if the guild has no such event
     */
    public boolean deleteEvent(long guildId, EventKind kind, long id) {
        String sql = switch (kind) {
            case CONTRIBUTION -> "DELETE FROM contribution_events WHERE guild_id = ? AND id = ?";
            case QUANTITY_CHANGE -> "DELETE FROM quantity_change_events WHERE guild_id = ? AND id = ?";
        };
        int deleted = storageHandle.inTransaction("delete-event", jdbc -> jdbc.update(sql, guildId, id));
        return deleted > 0;
    }

    /**
     * Rewrites the quantity of one contribution row. Only redistribution does this.
     */
    void updateContributionQuantity(long contributionId, long quantity) {
        if (quantity <= 0) {
            throw new InvalidQuantityException("Contribution quantity must be positive, got " + quantity);
        }
        storageHandle.inTransaction("update-contribution", jdbc -> jdbc.update(
            "UPDATE contribution_events SET quantity = ? WHERE id = ?", quantity, contributionId));
    }

    public int deleteContributions(long guildId) {
        return storageHandle.inTransaction("delete-contributions",
            jdbc -> jdbc.update("DELETE FROM contribution_events WHERE guild_id = ?", guildId));
    }

    public int deleteQuantityChanges(long guildId) {
        return storageHandle.inTransaction("delete-quantity-changes",
            jdbc -> jdbc.update("DELETE FROM quantity_change_events WHERE guild_id = ?", guildId));
    }

    private static long nextSequence(JdbcTemplate jdbc) {
        jdbc.update("UPDATE ledger_sequence SET next_value = next_value + 1 WHERE id = 1");
        Long value = jdbc.queryForObject("SELECT next_value - 1 FROM ledger_sequence WHERE id = 1", Long.class);
        if (value == null) {
            throw new IllegalStateException("ledger_sequence row is missing");
        }
        return value;
    }

    private static long lastInsertId(JdbcTemplate jdbc) {
        Long id = jdbc.queryForObject("SELECT last_insert_rowid()", Long.class);
        if (id == null) {
            throw new IllegalStateException("No row id returned for insert");
        }
        return id;
    }

    private static Instant instant(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis);
    }

    private RowMapper<ContributionEvent> contributionRowMapper() {
        return (rs, rowNum) -> ContributionEvent.builder()
            .id(rs.getLong("id"))
            .sequenceNumber(rs.getLong("sequence_number"))
            .guildId(rs.getLong("guild_id"))
            .actorId(rs.getLong("actor_id"))
            .category(rs.getString("category"))
            .itemName(rs.getString("item_name"))
            .quantity(rs.getLong("quantity"))
            .createdAt(instant(rs.getLong("created_at")))
            .build();
    }

    private RowMapper<QuantityChangeEvent> quantityChangeRowMapper() {
        return (rs, rowNum) -> QuantityChangeEvent.builder()
            .id(rs.getLong("id"))
            .sequenceNumber(rs.getLong("sequence_number"))
            .guildId(rs.getLong("guild_id"))
            .itemName(rs.getString("item_name"))
            .category(rs.getString("category"))
            .oldQuantity(rs.getLong("old_quantity"))
            .newQuantity(rs.getLong("new_quantity"))
            .reason(rs.getString("reason"))
            .notes(rs.getString("notes"))
            .actorId(rs.getLong("actor_id"))
            .changedAt(instant(rs.getLong("changed_at")))
            .build();
    }

    private RowMapper<LedgerEvent> ledgerEventRowMapper() {
        return (rs, rowNum) -> {
            EventKind kind = EventKind.fromWireName(rs.getString("event_kind"));
            return switch (kind) {
                case CONTRIBUTION -> ContributionEvent.builder()
                    .id(rs.getLong("id"))
                    .sequenceNumber(rs.getLong("sequence_number"))
                    .guildId(rs.getLong("guild_id"))
                    .actorId(rs.getLong("actor_id"))
                    .category(rs.getString("category"))
                    .itemName(rs.getString("item_name"))
                    .quantity(rs.getLong("quantity"))
                    .createdAt(instant(rs.getLong("occurred_at")))
                    .build();
                case QUANTITY_CHANGE -> QuantityChangeEvent.builder()
                    .id(rs.getLong("id"))
                    .sequenceNumber(rs.getLong("sequence_number"))
                    .guildId(rs.getLong("guild_id"))
                    .itemName(rs.getString("item_name"))
                    .category(rs.getString("category"))
                    .oldQuantity(rs.getLong("old_quantity"))
                    .newQuantity(rs.getLong("new_quantity"))
                    .reason(rs.getString("reason"))
                    .notes(rs.getString("notes"))
                    .actorId(rs.getLong("actor_id"))
                    .changedAt(instant(rs.getLong("occurred_at")))
                    .build();
            };
        };
    }
}
