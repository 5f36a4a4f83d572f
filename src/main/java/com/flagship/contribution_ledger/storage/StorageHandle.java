package com.flagship.contribution_ledger.storage;

import com.flagship.contribution_ledger.observability.LedgerMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns the single connection to the SQLite ledger file.
 *
 * Every other component routes its statements through this handle; nothing else
 * opens a connection. The connection is created lazily on first use and replaced
 * after a failure:
 * <ul>
 *   <li>(Re)creation is guarded by {@code connectionLock}; callers only block on it
 *       while a connection is being opened or discarded.</li>
 *   <li>Discarding also takes the write side of {@code statementLock}, so a connection
 *       is never closed under a running statement or transaction. The statement lock
 *       is always taken before the connection lock.</li>
 *   <li>Plain statements share the connection concurrently (read side of
 *       {@code statementLock}).</li>
 *   <li>Transactions take the write side, so no foreign statement can land inside
 *       another caller's BEGIN/COMMIT on the shared connection.</li>
 * </ul>
 *
 * Each (re)connect applies the concurrency pragmas (WAL, busy timeout, in-memory
 * temp store) and the idempotent schema script.
 *
 * Statements run in auto-commit mode and are committed as they execute;
 * {@link #inTransaction} commits once at the end of its callback.
 */
@Component
@Slf4j
public class StorageHandle {

    private final Path databasePath;
    private final int busyTimeoutMs;
    private final Resource schema;
    private final ResilientExecutor executor;
    private final LedgerMetrics metrics;

    private final ReentrantLock connectionLock = new ReentrantLock();
    private final ReentrantReadWriteLock statementLock = new ReentrantReadWriteLock(true);
    private volatile Session session;

    public StorageHandle(
            @Value("${ledger.storage.path:data/contribution-ledger.db}") String path,
            @Value("${ledger.storage.busy-timeout-ms:30000}") int busyTimeoutMs,
            @Value("${ledger.storage.schema-location:db/ledger-schema.sql}") String schemaLocation,
            ResilientExecutor executor,
            LedgerMetrics metrics) {
        this.databasePath = Paths.get(path).toAbsolutePath();
        this.busyTimeoutMs = busyTimeoutMs;
        this.schema = new ClassPathResource(schemaLocation);
        this.executor = executor;
        this.metrics = metrics;
        log.info("Ledger storage configured at {}", databasePath);
    }

    /**
     * Returns the template bound to the shared connection, opening it on first use.
     * Idempotent: concurrent callers all receive the same connection.
     */
    public JdbcTemplate acquire() {
        Session current = session;
        if (current != null) {
            return current.getJdbcTemplate();
        }
        return openIfAbsent().getJdbcTemplate();
    }

    /**
     * Runs idempotent work (reads) with retry. On each retryable failure the
     * connection is discarded and the whole callback runs again on a fresh one.
     */
    public <T> T execute(String operation, Function<JdbcTemplate, T> work) {
        if (isInTransaction()) {
            return work.apply(acquire());
        }
        try {
            return executor.execute(operation,
                    () -> withSharedLock(() -> work.apply(acquire())),
                    this::beforeRetry);
        } catch (StorageUnavailableException e) {
            metrics.recordStorageUnavailable();
            throw e;
        }
    }

    /**
     * Runs non-idempotent work (writes) exactly once. Only acquiring the connection
     * is retried; a failure of the statement itself is never repeated.
     */
    public <T> T executeOnce(String operation, Function<JdbcTemplate, T> work) {
        if (isInTransaction()) {
            return work.apply(acquire());
        }
        JdbcTemplate jdbcTemplate = connect(operation);
        try {
            return withSharedLock(() -> work.apply(jdbcTemplate));
        } catch (RuntimeException e) {
            throw translateFailure(operation, e);
        }
    }

    /**
     * Runs the callback inside one transaction on the shared connection, excluding
     * every other statement until it commits or rolls back. Nested calls from the
     * same thread join the running transaction. The transaction is not retried.
     */
    public <T> T inTransaction(String operation, Function<JdbcTemplate, T> work) {
        if (isInTransaction()) {
            return work.apply(acquire());
        }
        connect(operation);
        statementLock.writeLock().lock();
        try {
            Session current = openIfAbsent();
            return current.getTransactionTemplate()
                    .execute(status -> work.apply(current.getJdbcTemplate()));
        } catch (TransactionException e) {
            // Begin, commit or rollback failed on the connection itself
            discard();
            metrics.recordStorageUnavailable();
            log.error("Transaction '{}' failed on the storage connection: {}", operation, e.getMessage());
            throw new StorageUnavailableException(operation, 1, e);
        } catch (RuntimeException e) {
            throw translateFailure(operation, e);
        } finally {
            statementLock.writeLock().unlock();
        }
    }

    /**
     * Closes the shared connection; the next caller opens a new one. Waits for
     * running statements and transactions of other threads to finish first. Must
     * not be called while holding only the shared side of the statement lock.
     */
    public void discard() {
        if (release()) {
            log.warn("Discarded ledger storage connection to {}", databasePath);
        }
    }

    public boolean isHealthy() {
        try {
            Integer one = executeOnce("health-check",
                    jdbc -> jdbc.queryForObject("SELECT 1", Integer.class));
            return one != null && one == 1;
        } catch (RuntimeException e) {
            log.debug("Ledger storage health check failed: {}", e.getMessage());
            return false;
        }
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    @PreDestroy
    public void close() {
        if (release()) {
            log.info("Closed ledger storage connection to {}", databasePath);
        }
    }

    private boolean release() {
        statementLock.writeLock().lock();
        try {
            connectionLock.lock();
            try {
                Session current = session;
                session = null;
                if (current == null) {
                    return false;
                }
                current.getDataSource().destroy();
                return true;
            } finally {
                connectionLock.unlock();
            }
        } finally {
            statementLock.writeLock().unlock();
        }
    }

    private JdbcTemplate connect(String operation) {
        try {
            return executor.execute(operation + ":connect", this::acquire, this::beforeRetry);
        } catch (StorageUnavailableException e) {
            metrics.recordStorageUnavailable();
            throw e;
        }
    }

    private Session openIfAbsent() {
        connectionLock.lock();
        try {
            if (session == null) {
                session = open();
            }
            return session;
        } finally {
            connectionLock.unlock();
        }
    }

    private Session open() {
        createParentDirectory();

        SingleConnectionDataSource dataSource =
                new SingleConnectionDataSource("jdbc:sqlite:" + databasePath, true);
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setAutoCommit(true);

        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setExceptionTranslator(new SqliteExceptionTranslator());

        try {
            jdbcTemplate.execute("PRAGMA foreign_keys = ON");
            jdbcTemplate.execute("PRAGMA journal_mode = WAL");
            jdbcTemplate.execute("PRAGMA synchronous = NORMAL");
            jdbcTemplate.execute("PRAGMA cache_size = -2000");
            jdbcTemplate.execute("PRAGMA temp_store = MEMORY");
            jdbcTemplate.execute("PRAGMA busy_timeout = " + busyTimeoutMs);
            jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
                new ResourceDatabasePopulator(schema).populate(connection);
                return null;
            });
        } catch (RuntimeException e) {
            dataSource.destroy();
            throw e;
        }

        TransactionTemplate transactionTemplate =
                new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        log.info("Opened ledger storage connection to {}", databasePath);
        return new Session(dataSource, jdbcTemplate, transactionTemplate);
    }

    private void createParentDirectory() {
        Path parent = databasePath.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create ledger data directory " + parent, e);
        }
    }

    private <T> T withSharedLock(Supplier<T> work) {
        statementLock.readLock().lock();
        try {
            return work.get();
        } finally {
            statementLock.readLock().unlock();
        }
    }

    private void beforeRetry(Throwable failure) {
        metrics.recordStorageRetry();
        discard();
    }

    private RuntimeException translateFailure(String operation, RuntimeException e) {
        if (e instanceof StorageUnavailableException || !ResilientExecutor.isRetryable(e)) {
            return e;
        }
        discard();
        metrics.recordStorageUnavailable();
        log.error("Storage operation '{}' failed and will not be repeated: {}", operation, e.getMessage());
        return new StorageUnavailableException(operation, 1, e);
    }

    private static boolean isInTransaction() {
        return TransactionSynchronizationManager.isActualTransactionActive();
    }

    private static final class Session {
        private final SingleConnectionDataSource dataSource;
        private final JdbcTemplate jdbcTemplate;
        private final TransactionTemplate transactionTemplate;

        Session(SingleConnectionDataSource dataSource, JdbcTemplate jdbcTemplate,
                TransactionTemplate transactionTemplate) {
            this.dataSource = dataSource;
            this.jdbcTemplate = jdbcTemplate;
            this.transactionTemplate = transactionTemplate;
        }

        SingleConnectionDataSource getDataSource() {
            return dataSource;
        }

        JdbcTemplate getJdbcTemplate() {
            return jdbcTemplate;
        }

        TransactionTemplate getTransactionTemplate() {
            return transactionTemplate;
        }
    }
}
