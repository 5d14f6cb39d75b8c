package com.techwriter.store;

import java.sql.SQLException;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.support.SQLExceptionTranslator;

/**
 * Maps SQLITE_CONSTRAINT (foreign keys, checks, unique indexes and trigger aborts) to
 * {@link DataIntegrityViolationException}. Anything else falls through to the default translation.
 */
final class SqliteExceptionTranslator implements SQLExceptionTranslator {
    private static final int SQLITE_CONSTRAINT = 19;

    @Override
    public DataAccessException translate(String task, String sql, SQLException ex) {
        if ((ex.getErrorCode() & 0xff) == SQLITE_CONSTRAINT) {
            return new DataIntegrityViolationException(task + ": " + ex.getMessage(), ex);
        }
        return null;
    }
}
