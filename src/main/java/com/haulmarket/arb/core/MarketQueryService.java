package com.haulmarket.arb.core;

import com.haulmarket.arb.config.ArbitrageProperties;
import com.haulmarket.arb.domain.BestPrice;
import com.haulmarket.arb.domain.ItemInfo;
import com.haulmarket.arb.domain.Market;
import com.haulmarket.arb.domain.Opportunity;
import com.haulmarket.arb.domain.Route;
import com.haulmarket.arb.infra.sqlite.OpportunityDao;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class MarketQueryService {

    private final MarketDataSource dataSource;
    private final OpportunityDao opportunityDao;
    private final ArbitrageProperties properties;

    public Optional<BestPrice> bestSellPrice(String marketName, long itemId) {
        Market market = resolve(marketName);
        return BestPriceSelector.bestSell(
                dataSource.sellOrders(market.getId(), properties.getCache().getOrderTtl()).get(itemId));
    }

    public Optional<BestPrice> bestBuyPrice(String marketName, long itemId) {
        Market market = resolve(marketName);
        return BestPriceSelector.bestBuy(
                dataSource.buyOrders(market.getId(), properties.getCache().getOrderTtl()).get(itemId));
    }

    public ItemInfo itemInfo(long itemId) {
        return dataSource.itemInfo(itemId);
    }

    public List<ItemInfo> searchItems(String query) {
        return dataSource.searchItems(query);
    }

    public Map<Long, BigDecimal> adjustedPrices() {
        return dataSource.adjustedPrices();
    }

    public List<Opportunity> storedOpportunities(int limit) {
        try {
            return opportunityDao.findTop(limit);
        } catch (SQLException e) {
            throw new ResultStoreException("Failed to read stored opportunities", e);
        }
    }

    public List<Opportunity> storedOpportunities(Route route) {
        try {
            return opportunityDao.findByRoute(route);
        } catch (SQLException e) {
            throw new ResultStoreException("Failed to read stored opportunities for " + route, e);
        }
    }

    public Optional<Instant> lastScanTime() {
        try {
            return opportunityDao.lastScanTime();
        } catch (SQLException e) {
            throw new ResultStoreException("Failed to read last scan time", e);
        }
    }

    private Market resolve(String marketName) {
        Market market = properties.marketsByName().get(marketName);
        if (market == null) {
            throw new IllegalArgumentException("Unknown market: " + marketName);
        }
        return market;
    }
}
