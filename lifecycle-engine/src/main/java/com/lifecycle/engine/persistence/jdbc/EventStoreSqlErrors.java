package com.lifecycle.engine.persistence.jdbc;

import com.lifecycle.core.exception.ImmutableRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * Translates PostgreSQL errors raised by the event store triggers.
 */
public final class EventStoreSqlErrors {

    private static final Logger log = LoggerFactory.getLogger(EventStoreSqlErrors.class);

    /** SQLSTATE raised by the append-only triggers. */
    public static final String RAISE_EXCEPTION = "P0001";

    private EventStoreSqlErrors() {
    }

    /**
     * Run a statement against the event store, converting trigger rejections
     * into {@link ImmutableRecordException}.
     */
    public static <T> T guard(Supplier<T> statement) {
        try {
            return statement.get();
        } catch (DataAccessException e) {
            throw translate(e);
        }
    }

    public static RuntimeException translate(DataAccessException e) {
        SQLException sqlException = findSqlException(e);
        if (sqlException != null && RAISE_EXCEPTION.equals(sqlException.getSQLState())) {
            log.error("Rejected mutation of immutable event: {}", sqlException.getMessage());
            return new ImmutableRecordException(sqlException.getMessage(), e);
        }
        return e;
    }

    private static SQLException findSqlException(Throwable t) {
        Throwable current = t;
        while (current != null) {
            if (current instanceof SQLException sqlException) {
                return sqlException;
            }
            current = current.getCause();
        }
        return null;
    }
}
