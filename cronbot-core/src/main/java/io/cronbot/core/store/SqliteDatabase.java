package io.cronbot.core.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class SqliteDatabase implements SqlExecutor {
    private final String jdbcUrl;

    public SqliteDatabase(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    @Override
    public synchronized <T> List<T> query(String sql, List<?> params, RowMapper<T> mapper) throws IOException {
        return withConnection(executor -> executor.query(sql, params, mapper), false);
    }

    @Override
    public synchronized long insert(String sql, List<?> params) throws IOException {
        return withConnection(executor -> executor.insert(sql, params), false);
    }

    @Override
    public synchronized int update(String sql, List<?> params) throws IOException {
        return withConnection(executor -> executor.update(sql, params), false);
    }

    @Override
    public synchronized void execute(String ddl) throws IOException {
        withConnection(executor -> {
            executor.execute(ddl);
            return null;
        }, false);
    }

    @Override
    public synchronized <T> T inTransaction(TransactionWork<T> work) throws IOException {
        return withConnection(work, true);
    }

    private <T> T withConnection(TransactionWork<T> work, boolean transactional) throws IOException {
        try (Connection connection = openConnection()) {
            ConnectionExecutor executor = new ConnectionExecutor(connection);
            if (!transactional) {
                return work.execute(executor);
            }
            connection.setAutoCommit(false);
            try {
                T result = work.execute(executor);
                connection.commit();
                return result;
            } catch (IOException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            } catch (SQLException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("SQLite access failed for " + jdbcUrl, e);
        }
    }

    private void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA foreign_keys=ON;");
            statement.execute("PRAGMA busy_timeout=5000;");
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    private static final class ConnectionExecutor implements SqlExecutor {
        private final Connection connection;

        private ConnectionExecutor(Connection connection) {
            this.connection = connection;
        }

        @Override
        public <T> List<T> query(String sql, List<?> params, RowMapper<T> mapper) throws IOException {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                bind(statement, params);
                try (ResultSet resultSet = statement.executeQuery()) {
                    List<T> rows = new ArrayList<>();
                    while (resultSet.next()) {
                        rows.add(mapper.map(resultSet));
                    }
                    return rows;
                }
            } catch (SQLException e) {
                throw failure(sql, e);
            }
        }

        @Override
        public long insert(String sql, List<?> params) throws IOException {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                bind(statement, params);
                statement.executeUpdate();
            } catch (SQLException e) {
                throw failure(sql, e);
            }
            try (Statement statement = connection.createStatement();
                 ResultSet resultSet = statement.executeQuery("SELECT last_insert_rowid()")) {
                if (!resultSet.next()) {
                    throw new IOException("Insert did not produce a row id");
                }
                return resultSet.getLong(1);
            } catch (SQLException e) {
                throw failure("SELECT last_insert_rowid()", e);
            }
        }

        @Override
        public int update(String sql, List<?> params) throws IOException {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                bind(statement, params);
                return statement.executeUpdate();
            } catch (SQLException e) {
                throw failure(sql, e);
            }
        }

        @Override
        public void execute(String ddl) throws IOException {
            try (Statement statement = connection.createStatement()) {
                statement.execute(ddl);
            } catch (SQLException e) {
                throw failure(ddl, e);
            }
        }

        @Override
        public <T> T inTransaction(TransactionWork<T> work) throws IOException {
            // already inside the caller's transaction
            return work.execute(this);
        }

        private void bind(PreparedStatement statement, List<?> params) throws SQLException {
            if (params == null) {
                return;
            }
            for (int i = 0; i < params.size(); i++) {
                Object value = params.get(i);
                int index = i + 1;
                if (value == null) {
                    statement.setNull(index, Types.NULL);
                } else if (value instanceof Instant instant) {
                    statement.setLong(index, instant.toEpochMilli());
                } else if (value instanceof Boolean flag) {
                    statement.setInt(index, flag ? 1 : 0);
                } else if (value instanceof Enum<?> constant) {
                    statement.setString(index, constant.name());
                } else {
                    statement.setObject(index, value);
                }
            }
        }

        private IOException failure(String sql, SQLException e) {
            return new IOException("Statement failed (" + e.getMessage() + "): " + compact(sql), e);
        }

        private String compact(String sql) {
            String flat = sql.replaceAll("\\s+", " ").trim();
            return flat.length() <= 160 ? flat : flat.substring(0, 160) + "...";
        }
    }
}
