package com.haulmarket.arb.infra.sqlite;

import com.haulmarket.arb.domain.ItemInfo;
import lombok.Value;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Rows of the order page and item metadata cache tables. Writes are upserts keyed by
 * (market_id, page) and item_id; the last writer wins.
 */
public class MarketCacheDao {

    private final SqliteConnection conn;

    public MarketCacheDao(SqliteConnection conn) {
        this.conn = conn;
    }

    public Optional<PageRow> findPage(long marketId, int page) throws SQLException {
        return conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement("""
                    SELECT total_pages, fetched_at, orders_json
                    FROM market_cache
                    WHERE market_id = ? AND page = ?
                    """)) {
                stmt.setLong(1, marketId);
                stmt.setInt(2, page);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new PageRow(marketId, page, rs.getInt("total_pages"),
                            rs.getLong("fetched_at"), rs.getString("orders_json")));
                }
            }
        });
    }

    public void upsertPage(long marketId, int page, int totalPages, String ordersJson, long fetchedAt)
            throws SQLException {
        conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement("""
                    INSERT INTO market_cache (market_id, page, total_pages, fetched_at, orders_json)
                    VALUES (?, ?, ?, ?, ?)
                    ON CONFLICT(market_id, page) DO UPDATE SET
                        total_pages = excluded.total_pages,
                        fetched_at = excluded.fetched_at,
                        orders_json = excluded.orders_json
                    """)) {
                stmt.setLong(1, marketId);
                stmt.setInt(2, page);
                stmt.setInt(3, totalPages);
                stmt.setLong(4, fetchedAt);
                stmt.setString(5, ordersJson);
                return stmt.executeUpdate();
            }
        });
    }

    public int countPages(long marketId) throws SQLException {
        return conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement(
                    "SELECT COUNT(*) FROM market_cache WHERE market_id = ?")) {
                stmt.setLong(1, marketId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    public Optional<ItemRow> findItem(long itemId) throws SQLException {
        return conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement(
                    "SELECT name, bulk, placeholder, fetched_at FROM item_info WHERE item_id = ?")) {
                stmt.setLong(1, itemId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    ItemInfo info = ItemInfo.builder()
                            .itemId(itemId)
                            .name(rs.getString("name"))
                            .bulk(BigDecimal.valueOf(rs.getDouble("bulk")))
                            .placeholder(rs.getInt("placeholder") != 0)
                            .build();
                    return Optional.of(new ItemRow(info, rs.getLong("fetched_at")));
                }
            }
        });
    }

    public void upsertItem(ItemInfo info, long fetchedAt) throws SQLException {
        conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement("""
                    INSERT INTO item_info (item_id, name, bulk, placeholder, fetched_at)
                    VALUES (?, ?, ?, ?, ?)
                    ON CONFLICT(item_id) DO UPDATE SET
                        name = excluded.name,
                        bulk = excluded.bulk,
                        placeholder = excluded.placeholder,
                        fetched_at = excluded.fetched_at
                    """)) {
                stmt.setLong(1, info.getItemId());
                stmt.setString(2, info.getName());
                stmt.setDouble(3, info.getBulk().doubleValue());
                stmt.setInt(4, info.isPlaceholder() ? 1 : 0);
                stmt.setLong(5, fetchedAt);
                return stmt.executeUpdate();
            }
        });
    }

    public int countItems() throws SQLException {
        return conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement("SELECT COUNT(*) FROM item_info");
                 ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    @Value
    public static class PageRow {
        long marketId;
        int page;
        int totalPages;
        long fetchedAt;
        String ordersJson;
    }

    @Value
    public static class ItemRow {
        ItemInfo info;
        long fetchedAt;
    }
}
