package io.cronbot.core.store;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Narrow statement-execution contract the job and execution-log tables are built on.
 * Parameters are bound positionally; {@link java.time.Instant} values are bound as epoch
 * milliseconds, enums by name and booleans as {@code 0/1}.
 */
public interface SqlExecutor {

    <T> List<T> query(String sql, List<?> params, RowMapper<T> mapper) throws IOException;

    /**
     * Runs an insert and returns the generated row id.
     */
    long insert(String sql, List<?> params) throws IOException;

    /**
     * Runs an update or delete and returns the number of affected rows.
     */
    int update(String sql, List<?> params) throws IOException;

    void execute(String ddl) throws IOException;

    /**
     * Runs {@code work} against a single connection; commits if it returns, rolls back if it throws.
     */
    <T> T inTransaction(TransactionWork<T> work) throws IOException;

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet row) throws SQLException;
    }

    @FunctionalInterface
    interface TransactionWork<T> {
        T execute(SqlExecutor transaction) throws IOException;
    }
}
