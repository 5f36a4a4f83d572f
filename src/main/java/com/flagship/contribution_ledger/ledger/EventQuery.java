package com.flagship.contribution_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Filter for {@link EventStore#queryEvents}. Null filters match everything;
 * a null limit returns the full history.
 */
@Value
@Builder
public class EventQuery {
    long guildId;
    String itemName;
    String category;
    Integer limit;

    public static EventQuery forGuild(long guildId) {
        return EventQuery.builder().guildId(guildId).build();
    }

    public static EventQuery forItem(long guildId, ItemKey key) {
        return EventQuery.builder()
                .guildId(guildId)
                .category(key.getCategory())
                .itemName(key.getItemName())
                .build();
    }

    public boolean hasLimit() {
        return limit != null && limit > 0;
    }
}
