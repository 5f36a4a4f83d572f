package com.flagship.contribution_ledger.storage;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.support.AbstractFallbackSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLExceptionSubclassTranslator;

import java.sql.SQLException;

/**
 * Maps SQLite result codes onto Spring's DataAccessException hierarchy.
 *
 * Busy and locked databases become {@link CannotAcquireLockException} (transient),
 * I/O failures and closed connections become {@link DataAccessResourceFailureException}.
 * Everything else falls through to the JDBC subclass translator.
 */
public class SqliteExceptionTranslator extends AbstractFallbackSQLExceptionTranslator {

    public SqliteExceptionTranslator() {
        setFallbackTranslator(new SQLExceptionSubclassTranslator());
    }

    @Override
    protected DataAccessException doTranslate(String task, String sql, SQLException ex) {
        String message = buildMessage(task, sql, ex);

        if (ex instanceof SQLiteException sqliteException) {
            // Extended result codes carry the primary code in the low byte
            int primary = sqliteException.getResultCode().code & 0xFF;

            if (primary == SQLiteErrorCode.SQLITE_BUSY.code
                    || primary == SQLiteErrorCode.SQLITE_LOCKED.code) {
                return new CannotAcquireLockException(message, ex);
            }
            if (primary == SQLiteErrorCode.SQLITE_IOERR.code
                    || primary == SQLiteErrorCode.SQLITE_CANTOPEN.code
                    || primary == SQLiteErrorCode.SQLITE_PROTOCOL.code) {
                return new DataAccessResourceFailureException(message, ex);
            }
            return null;
        }

        if (isClosedConnection(ex)) {
            return new DataAccessResourceFailureException(message, ex);
        }
        return null;
    }

    private boolean isClosedConnection(SQLException ex) {
        String detail = ex.getMessage();
        return detail != null && detail.toLowerCase().contains("connection closed");
    }
}
