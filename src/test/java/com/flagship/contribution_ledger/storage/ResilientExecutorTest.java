package com.flagship.contribution_ledger.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResilientExecutorTest {

    private final ResilientExecutor executor = new ResilientExecutor(4, 1, 2.0, 5);

    @Test
    @DisplayName("Transient failures are retried until the work succeeds")
    void retriesTransientFailure() {
        AtomicInteger calls = new AtomicInteger();
        List<Throwable> seenBeforeRetry = new ArrayList<>();

        String result = executor.execute("read", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("database is locked");
            }
            return "ok";
        }, seenBeforeRetry::add);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(2, seenBeforeRetry.size());
        assertTrue(seenBeforeRetry.get(0) instanceof CannotAcquireLockException);
    }

    @Test
    @DisplayName("Exhausted retries surface as StorageUnavailableException")
    void exhaustedRetries() {
        AtomicInteger calls = new AtomicInteger();

        StorageUnavailableException e = assertThrows(StorageUnavailableException.class,
            () -> executor.execute("read", () -> {
                calls.incrementAndGet();
                throw new DataAccessResourceFailureException("disk I/O error");
            }));

        assertEquals(4, calls.get());
        assertEquals(4, e.getAttempts());
        assertEquals("read", e.getOperation());
        assertTrue(e.getCause() instanceof DataAccessResourceFailureException);
    }

    @Test
    @DisplayName("Non-retryable failures propagate from the first attempt")
    void nonRetryablePropagates() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(DataIntegrityViolationException.class, () -> executor.execute("write", () -> {
            calls.incrementAndGet();
            throw new DataIntegrityViolationException("CHECK constraint failed");
        }));
        assertEquals(1, calls.get());

        assertThrows(IllegalArgumentException.class, () -> executor.execute("validate", () -> {
            throw new IllegalArgumentException("bad input");
        }));
    }

    @Test
    @DisplayName("Retryability is decided by the cause chain")
    void retryableCauseChain() {
        RuntimeException wrapped = new RuntimeException("outer", new CannotAcquireLockException("busy"));

        assertTrue(ResilientExecutor.isRetryable(wrapped));
        assertFalse(ResilientExecutor.isRetryable(new IllegalStateException("nope")));
        assertFalse(ResilientExecutor.isRetryable(null));
    }

    @Test
    @DisplayName("At least one attempt is required")
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new ResilientExecutor(0, 1, 2.0, 5));
    }

    @Test
    @DisplayName("The delay between attempts doubles from the initial delay")
    void backoffDoubles() {
        List<Long> sleeps = new ArrayList<>();
        ResilientExecutor recording = new ResilientExecutor(4, 100, 2.0, 5_000, sleeps::add);

        assertThrows(StorageUnavailableException.class, () -> recording.execute("busy", () -> {
            throw new CannotAcquireLockException("database is locked");
        }));

        assertEquals(List.of(100L, 200L, 400L), sleeps);
    }

    @Test
    @DisplayName("The delay never exceeds the configured ceiling")
    void backoffIsCapped() {
        List<Long> sleeps = new ArrayList<>();
        ResilientExecutor recording = new ResilientExecutor(5, 100, 2.0, 250, sleeps::add);

        assertThrows(StorageUnavailableException.class, () -> recording.execute("busy", () -> {
            throw new DataAccessResourceFailureException("unable to open database file");
        }));

        assertEquals(List.of(100L, 200L, 250L, 250L), sleeps);
    }

    @Test
    @DisplayName("Non-retryable failures never back off")
    void noBackoffWithoutRetry() {
        List<Long> sleeps = new ArrayList<>();
        ResilientExecutor recording = new ResilientExecutor(4, 100, 2.0, 5_000, sleeps::add);

        assertThrows(IllegalArgumentException.class, () -> recording.execute("validate", () -> {
            throw new IllegalArgumentException("bad input");
        }));

        assertTrue(sleeps.isEmpty());
    }
}
