package com.flagship.contribution_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID flows through:
 * - HTTP requests (from header or generated)
 * - Ledger operations (guild and item key are added to MDC while they run)
 * - All log statements (via MDC)
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String GUILD_ID_MDC_KEY = "guildId";
    public static final String ITEM_KEY_MDC_KEY = "itemKey";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Clears the correlation ID from the current thread.
     * Should be called at the end of request processing.
     */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Tags log lines with the guild and item key of a ledger operation.
     * Close the returned scope to restore the previous values.
     */
    public static Scope forItem(long guildId, String itemKey) {
        String previousGuild = MDC.get(GUILD_ID_MDC_KEY);
        String previousItem = MDC.get(ITEM_KEY_MDC_KEY);
        MDC.put(GUILD_ID_MDC_KEY, Long.toString(guildId));
        if (itemKey != null) {
            MDC.put(ITEM_KEY_MDC_KEY, itemKey);
        }
        return () -> {
            restore(GUILD_ID_MDC_KEY, previousGuild);
            restore(ITEM_KEY_MDC_KEY, previousItem);
        };
    }

    public static Scope forGuild(long guildId) {
        return forItem(guildId, null);
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    /**
     * MDC scope usable in try-with-resources.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
