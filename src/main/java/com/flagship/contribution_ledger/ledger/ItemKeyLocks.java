package com.flagship.contribution_ledger.ledger;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes read-then-write sequences on the same item within this process.
 *
 * Locks are reentrant, so an adjustment may call redistribution while holding the
 * lock for the same item. An item lock is always taken before the storage lock,
 * never after.
 *
 * Entries are never evicted: one lock per item touched is kept for the lifetime of
 * the process, which a guild's item catalogue keeps small.
 */
@Component
public class ItemKeyLocks {

    private final ConcurrentMap<LockKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long guildId, ItemKey key, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(new LockKey(guildId, key), k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return locks.size();
    }

    @Value
    private static class LockKey {
        long guildId;
        ItemKey itemKey;
    }
}
