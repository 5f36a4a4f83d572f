package com.flagship.contribution_ledger.storage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs storage work with exponential backoff.
 *
 * Only failures that are safe to repeat are retried: transient errors (busy/locked
 * database), recoverable errors and resource failures (dropped or unopenable
 * connection). Before each new attempt the supplied hook runs, which StorageHandle
 * uses to discard the broken connection. Once the attempt ceiling is reached the
 * last failure is wrapped in {@link StorageUnavailableException}.
 *
 * Any other exception propagates immediately from the first attempt.
 */
@Component
@Slf4j
public class ResilientExecutor {

    private static final String OPERATION_KEY = "ledger.operation";

    @Getter
    private final int maxAttempts;
    private final RetryTemplate retryTemplate;

    @Autowired
    public ResilientExecutor(
            @Value("${ledger.storage.retry.max-attempts:5}") int maxAttempts,
            @Value("${ledger.storage.retry.initial-delay-ms:100}") long initialDelayMs,
            @Value("${ledger.storage.retry.multiplier:2.0}") double multiplier,
            @Value("${ledger.storage.retry.max-delay-ms:5000}") long maxDelayMs) {
        this(maxAttempts, initialDelayMs, multiplier, maxDelayMs, new ThreadWaitSleeper());
    }

    ResilientExecutor(int maxAttempts, long initialDelayMs, double multiplier, long maxDelayMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be at least 1");
        }
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(Math.max(1L, initialDelayMs));
        backOff.setMultiplier(multiplier);
        backOff.setMaxInterval(Math.max(1L, maxDelayMs));
        backOff.setSleeper(sleeper);

        this.maxAttempts = maxAttempts;
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .customBackoff(backOff)
                .retryOn(TransientDataAccessException.class)
                .retryOn(RecoverableDataAccessException.class)
                .retryOn(DataAccessResourceFailureException.class)
                .traversingCauses()
                .withListener(new AttemptLogger())
                .build();
    }

    /**
     * Executes the work, retrying retryable failures.
     *
     * @param operation name used in logs and in the final exception
     * @param work the storage work; re-invoked in full on each attempt
     * @param beforeRetry called with the previous failure at the start of each retry
     * @return the work's result
     * @throws StorageUnavailableException when every attempt failed with a retryable error
     */
    public <T> T execute(String operation, Supplier<T> work, Consumer<Throwable> beforeRetry) {
        RetryCallback<T, RuntimeException> callback = context -> {
            context.setAttribute(OPERATION_KEY, operation);
            if (context.getLastThrowable() != null) {
                beforeRetry.accept(context.getLastThrowable());
            }
            return work.get();
        };

        try {
            return retryTemplate.execute(callback);
        } catch (RuntimeException e) {
            if (!isRetryable(e)) {
                throw e;
            }
            log.error("Storage operation '{}' failed after {} attempt(s): {}",
                    operation, maxAttempts, e.getMessage());
            throw new StorageUnavailableException(operation, maxAttempts, e);
        }
    }

    public <T> T execute(String operation, Supplier<T> work) {
        return execute(operation, work, failure -> { });
    }

    static boolean isRetryable(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof TransientDataAccessException
                    || t instanceof RecoverableDataAccessException
                    || t instanceof DataAccessResourceFailureException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static final class AttemptLogger implements RetryListener {

        @Override
        public <T, E extends Throwable> void onError(RetryContext context,
                                                     RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            log.warn("Storage operation '{}' attempt {} failed: {}",
                    context.getAttribute(OPERATION_KEY), context.getRetryCount(), throwable.getMessage());
        }
    }
}
