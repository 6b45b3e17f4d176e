package com.haulmarket.arb.infra.sqlite;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

@Slf4j
public final class SqliteSchema {

    public static final int CURRENT_VERSION = 1;

    private SqliteSchema() {
    }

    public static void initialize(SqliteConnection conn) throws SQLException {
        conn.executeInTransaction(c -> {
            int currentVersion = getSchemaVersion(c);
            if (currentVersion < CURRENT_VERSION) {
                createAllTables(c);
                setSchemaVersion(c, CURRENT_VERSION);
                log.info("Created SQLite schema v{} at {}", CURRENT_VERSION, conn.getDbFile());
            } else {
                log.debug("SQLite schema v{} up to date", currentVersion);
            }
            return null;
        });
    }

    private static int getSchemaVersion(Connection conn) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, "schema_version", null)) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    private static void setSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_version (version, applied_at) VALUES (?, ?)")) {
            stmt.setInt(1, version);
            stmt.setLong(2, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private static void createAllTables(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    applied_at INTEGER NOT NULL
                )
                """);

            // One row per (market, page); orders kept as the upstream JSON array
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS market_cache (
                    market_id INTEGER NOT NULL,
                    page INTEGER NOT NULL,
                    total_pages INTEGER NOT NULL,
                    fetched_at INTEGER NOT NULL,
                    orders_json TEXT NOT NULL,
                    PRIMARY KEY (market_id, page)
                ) WITHOUT ROWID
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS item_info (
                    item_id INTEGER PRIMARY KEY,
                    name TEXT NOT NULL,
                    bulk REAL NOT NULL DEFAULT 1.0,
                    placeholder INTEGER NOT NULL DEFAULT 0,
                    fetched_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS arbitrage_results (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    scanned_at INTEGER NOT NULL,
                    source_market TEXT NOT NULL,
                    destination_market TEXT NOT NULL,
                    item_id INTEGER NOT NULL,
                    item_name TEXT NOT NULL,
                    item_bulk REAL NOT NULL,
                    buy_price REAL NOT NULL,
                    sell_price REAL NOT NULL,
                    volume_available INTEGER NOT NULL,
                    net_profit_per_unit REAL NOT NULL,
                    profit_margin_pct REAL NOT NULL,
                    total_profit_potential REAL NOT NULL
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_results_route
                ON arbitrage_results(source_market, destination_market)
                """);
        }
    }
}
