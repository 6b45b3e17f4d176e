package com.haulmarket.arb.core;

import com.haulmarket.arb.domain.ItemInfo;
import com.haulmarket.arb.domain.MarketOrder;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * What the matcher and query layers need from the market: order books by side and item
 * metadata, served from cache where fresh enough.
 */
public interface MarketDataSource {

    Map<Long, List<MarketOrder>> sellOrders(long marketId, Duration ttl);

    Map<Long, List<MarketOrder>> buyOrders(long marketId, Duration ttl);

    ItemInfo itemInfo(long itemId);

    /**
     * Resolves every id, answering cached ids first and fetching only the rest.
     */
    Map<Long, ItemInfo> itemInfoBulk(Collection<Long> itemIds);

    List<ItemInfo> searchItems(String query);

    Map<Long, BigDecimal> adjustedPrices();
}
