package com.haulmarket.arb.infra.sqlite;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the single SQLite connection behind the market cache and the result store.
 *
 * <p>All access goes through {@link #execute} or {@link #executeInTransaction}, which
 * serialize on one lock. A reader therefore never runs between the statements of an
 * open transaction on the shared connection.
 */
@Slf4j
public class SqliteConnection implements AutoCloseable {

    private final File dbFile;
    private Connection connection;
    private final Object connLock = new Object();

    public SqliteConnection(File dbFile) {
        this.dbFile = dbFile;
    }

    public File getDbFile() {
        return dbFile;
    }

    /**
     * Run a statement sequence under the connection lock, in auto-commit mode.
     */
    public <T> T execute(TransactionFunction<T> function) throws SQLException {
        synchronized (connLock) {
            return function.apply(openConnection());
        }
    }

    /**
     * Execute a function within a transaction. Rolls back and rethrows on failure.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        synchronized (connLock) {
            Connection conn = openConnection();
            boolean autoCommitOriginal = conn.getAutoCommit();
            try {
                conn.setAutoCommit(false);
                T result = function.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage());
                    e.addSuppressed(rollbackEx);
                }
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(autoCommitOriginal);
                } catch (SQLException e) {
                    log.warn("Could not restore auto-commit on {}: {}", dbFile.getName(), e.getMessage());
                }
            }
        }
    }

    @Override
    public void close() {
        synchronized (connLock) {
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed SQLite connection for {}", dbFile.getAbsolutePath());
                } catch (SQLException e) {
                    log.warn("Error closing {}: {}", dbFile.getName(), e.getMessage());
                }
                connection = null;
            }
        }
    }

    private Connection openConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            connection = createConnection();
        }
        return connection;
    }

    private Connection createConnection() throws SQLException {
        File parentDir = dbFile.getAbsoluteFile().getParentFile();
        if (parentDir != null && !parentDir.exists() && !parentDir.mkdirs()) {
            throw new SQLException("Cannot create directory " + parentDir);
        }

        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.getAbsolutePath());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA busy_timeout=5000");
        }
        log.debug("Created SQLite connection at {}", dbFile.getAbsolutePath());
        return conn;
    }

    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }
}
