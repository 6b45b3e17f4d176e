package com.haulmarket.arb.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.haulmarket.arb.config.ArbitrageProperties;
import com.haulmarket.arb.domain.CachedPage;
import com.haulmarket.arb.domain.ItemInfo;
import com.haulmarket.arb.domain.MarketOrder;
import com.haulmarket.arb.infra.MarketJsonMapper;
import com.haulmarket.arb.infra.sqlite.MarketCacheDao;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent TTL cache for order-book pages and item metadata.
 *
 * <p>An entry fetched at {@code T} is served while {@code now <= T + ttl}; past that,
 * or when missing, lookups return empty and the caller refetches and stores. Writes are
 * upserts, so the newest write for a key wins. Placeholder item metadata is only served
 * for the shorter placeholder TTL.
 */
@Slf4j
@Component
public class MarketCache {

    private final MarketCacheDao dao;
    private final MarketJsonMapper jsonMapper;
    private final Clock clock;
    private final Duration defaultItemTtl;
    private final Duration placeholderItemTtl;

    public MarketCache(MarketCacheDao dao, MarketJsonMapper jsonMapper, Clock clock, ArbitrageProperties properties) {
        this.dao = dao;
        this.jsonMapper = jsonMapper;
        this.clock = clock;
        this.defaultItemTtl = properties.getCache().getItemTtl();
        this.placeholderItemTtl = properties.getCache().getPlaceholderItemTtl();
    }

    public Optional<CachedPage> getPage(long marketId, int page, Duration ttl) {
        Optional<MarketCacheDao.PageRow> row;
        try {
            row = dao.findPage(marketId, page);
        } catch (SQLException e) {
            throw new MarketCacheException("Failed to read cached page " + page + " of market " + marketId, e);
        }
        if (row.isEmpty()) {
            return Optional.empty();
        }
        Instant fetchedAt = Instant.ofEpochMilli(row.get().getFetchedAt());
        if (isExpired(fetchedAt, ttl)) {
            return Optional.empty();
        }
        try {
            List<MarketOrder> orders = jsonMapper.parseOrders(row.get().getOrdersJson(), marketId);
            return Optional.of(new CachedPage(marketId, page, row.get().getTotalPages(), fetchedAt, orders));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cached page {} of market {}, treating as absent: {}", page, marketId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Store one page as returned by the upstream and return its parsed form.
     */
    public CachedPage putPage(long marketId, int page, int totalPages, String ordersJson) {
        List<MarketOrder> orders;
        try {
            orders = jsonMapper.parseOrders(ordersJson, marketId);
        } catch (JsonProcessingException e) {
            throw new MarketCacheException("Refusing to cache malformed page " + page + " of market " + marketId, e);
        }
        Instant now = clock.instant();
        try {
            dao.upsertPage(marketId, page, totalPages, ordersJson, now.toEpochMilli());
        } catch (SQLException e) {
            throw new MarketCacheException("Failed to cache page " + page + " of market " + marketId, e);
        }
        return new CachedPage(marketId, page, totalPages, now, orders);
    }

    public Optional<ItemInfo> getItem(long itemId) {
        return getItem(itemId, defaultItemTtl);
    }

    public Optional<ItemInfo> getItem(long itemId, Duration ttl) {
        Optional<MarketCacheDao.ItemRow> row;
        try {
            row = dao.findItem(itemId);
        } catch (SQLException e) {
            throw new MarketCacheException("Failed to read cached item " + itemId, e);
        }
        if (row.isEmpty()) {
            return Optional.empty();
        }
        ItemInfo info = row.get().getInfo();
        Duration effectiveTtl = info.isPlaceholder() && placeholderItemTtl.compareTo(ttl) < 0 ? placeholderItemTtl : ttl;
        if (isExpired(Instant.ofEpochMilli(row.get().getFetchedAt()), effectiveTtl)) {
            return Optional.empty();
        }
        return Optional.of(info);
    }

    public void putItem(ItemInfo info) {
        try {
            dao.upsertItem(info, clock.instant().toEpochMilli());
        } catch (SQLException e) {
            throw new MarketCacheException("Failed to cache item " + info.getItemId(), e);
        }
    }

    private boolean isExpired(Instant fetchedAt, Duration ttl) {
        return clock.instant().isAfter(fetchedAt.plus(ttl));
    }
}
