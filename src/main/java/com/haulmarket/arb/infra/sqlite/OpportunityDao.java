package com.haulmarket.arb.infra.sqlite;

import com.haulmarket.arb.domain.Opportunity;
import com.haulmarket.arb.domain.Route;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
public class OpportunityDao {

    private static final String SELECT_COLUMNS = """
            SELECT source_market, destination_market, item_id, item_name, item_bulk,
                   buy_price, sell_price, volume_available,
                   net_profit_per_unit, profit_margin_pct, total_profit_potential
            FROM arbitrage_results
            """;

    private final SqliteConnection conn;

    public OpportunityDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * Replace the stored slice for {@code route} with {@code opportunities} in one transaction.
     * Every opportunity must belong to the route.
     */
    public int replaceRoute(Route route, List<Opportunity> opportunities, Instant scannedAt) throws SQLException {
        for (Opportunity opp : opportunities) {
            if (!route.equals(opp.getRoute())) {
                throw new IllegalArgumentException("Opportunity for " + opp.getRoute() + " stored under " + route);
            }
        }
        return conn.executeInTransaction(c -> {
            int deleted;
            try (PreparedStatement delete = c.prepareStatement(
                    "DELETE FROM arbitrage_results WHERE source_market = ? AND destination_market = ?")) {
                delete.setString(1, route.getSource());
                delete.setString(2, route.getDestination());
                deleted = delete.executeUpdate();
            }

            try (PreparedStatement insert = c.prepareStatement("""
                    INSERT INTO arbitrage_results
                    (scanned_at, source_market, destination_market, item_id, item_name, item_bulk,
                     buy_price, sell_price, volume_available,
                     net_profit_per_unit, profit_margin_pct, total_profit_potential)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                for (Opportunity opp : opportunities) {
                    insert.setLong(1, scannedAt.toEpochMilli());
                    insert.setString(2, opp.getSourceMarket());
                    insert.setString(3, opp.getDestinationMarket());
                    insert.setLong(4, opp.getItemId());
                    insert.setString(5, opp.getItemName());
                    insert.setDouble(6, opp.getItemBulk().doubleValue());
                    insert.setDouble(7, opp.getBuyPrice().doubleValue());
                    insert.setDouble(8, opp.getSellPrice().doubleValue());
                    insert.setLong(9, opp.getVolumeAvailable());
                    insert.setDouble(10, opp.getNetProfitPerUnit().doubleValue());
                    insert.setDouble(11, opp.getProfitMarginPct().doubleValue());
                    insert.setDouble(12, opp.getTotalProfitPotential().doubleValue());
                    insert.addBatch();
                }
                insert.executeBatch();
            }
            log.debug("Replaced {} stored results with {} for {}", deleted, opportunities.size(), route);
            return opportunities.size();
        });
    }

    public List<Opportunity> findByRoute(Route route) throws SQLException {
        return conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement(SELECT_COLUMNS + """
                    WHERE source_market = ? AND destination_market = ?
                    ORDER BY total_profit_potential DESC
                    """)) {
                stmt.setString(1, route.getSource());
                stmt.setString(2, route.getDestination());
                return readAll(stmt);
            }
        });
    }

    public List<Opportunity> findTop(int limit) throws SQLException {
        return conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement(SELECT_COLUMNS + """
                    ORDER BY total_profit_potential DESC
                    LIMIT ?
                    """)) {
                stmt.setInt(1, limit);
                return readAll(stmt);
            }
        });
    }

    public Optional<Instant> lastScanTime() throws SQLException {
        return conn.execute(c -> {
            try (Statement stmt = c.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT MAX(scanned_at) FROM arbitrage_results")) {
                if (rs.next()) {
                    long millis = rs.getLong(1);
                    if (!rs.wasNull()) {
                        return Optional.of(Instant.ofEpochMilli(millis));
                    }
                }
                return Optional.empty();
            }
        });
    }

    private static List<Opportunity> readAll(PreparedStatement stmt) throws SQLException {
        List<Opportunity> results = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                results.add(Opportunity.builder()
                        .sourceMarket(rs.getString("source_market"))
                        .destinationMarket(rs.getString("destination_market"))
                        .itemId(rs.getLong("item_id"))
                        .itemName(rs.getString("item_name"))
                        .itemBulk(BigDecimal.valueOf(rs.getDouble("item_bulk")))
                        .buyPrice(BigDecimal.valueOf(rs.getDouble("buy_price")))
                        .sellPrice(BigDecimal.valueOf(rs.getDouble("sell_price")))
                        .volumeAvailable(rs.getLong("volume_available"))
                        .netProfitPerUnit(BigDecimal.valueOf(rs.getDouble("net_profit_per_unit")))
                        .profitMarginPct(BigDecimal.valueOf(rs.getDouble("profit_margin_pct")))
                        .totalProfitPotential(BigDecimal.valueOf(rs.getDouble("total_profit_potential")))
                        .build());
            }
        }
        return results;
    }
}
