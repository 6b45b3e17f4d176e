package com.haulmarket.arb.core;

import com.haulmarket.arb.config.ArbitrageProperties;
import com.haulmarket.arb.domain.CachedPage;
import com.haulmarket.arb.domain.ItemInfo;
import com.haulmarket.arb.domain.MarketOrder;
import com.haulmarket.arb.domain.SplitOrderBook;
import com.haulmarket.arb.infra.ApiResponse;
import com.haulmarket.arb.infra.MarketApiClient;
import com.haulmarket.arb.infra.MarketApiException;
import com.haulmarket.arb.infra.MarketJsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class CachingMarketDataSource implements MarketDataSource {

    private static final int SEARCH_LIMIT = 20;

    private final MarketApiClient apiClient;
    private final MarketCache cache;
    private final MarketJsonMapper jsonMapper;
    private final String pagesHeader;

    public CachingMarketDataSource(MarketApiClient apiClient,
                                   MarketCache cache,
                                   MarketJsonMapper jsonMapper,
                                   ArbitrageProperties properties) {
        this.apiClient = apiClient;
        this.cache = cache;
        this.jsonMapper = jsonMapper;
        this.pagesHeader = properties.getApi().getPagesHeader();
    }

    /**
     * Every order in one market's book. Page 1 decides how many pages there are, so
     * pages are walked in order; each page comes from the cache when fresh and from the
     * upstream otherwise.
     */
    public List<MarketOrder> fetchMarketOrders(long marketId, Duration ttl) {
        List<MarketOrder> allOrders = new ArrayList<>();
        int page = 1;
        int totalPages = 1;
        int cacheHits = 0;

        while (page <= totalPages) {
            CachedPage current;
            Optional<CachedPage> cached = cache.getPage(marketId, page, ttl);
            if (cached.isPresent()) {
                current = cached.get();
                cacheHits++;
                log.debug("Market {} page {} served from cache", marketId, page);
            } else {
                ApiResponse response = apiClient.getOrderPage(marketId, page);
                int reportedPages = page == 1 ? Math.max(1, response.intHeader(pagesHeader, 1)) : totalPages;
                current = cache.putPage(marketId, page, reportedPages, response.getRawBody());
                log.debug("Market {} page {} fetched ({} orders)", marketId, page, current.getOrders().size());
            }

            if (page == 1) {
                totalPages = Math.max(1, current.getTotalPages());
            }
            allOrders.addAll(current.getOrders());
            page++;
        }

        log.info("Market {}: {} orders across {} pages ({} from cache)", marketId, allOrders.size(), totalPages,
                cacheHits);
        return allOrders;
    }

    public SplitOrderBook orderBook(long marketId, Duration ttl) {
        return SplitOrderBook.of(fetchMarketOrders(marketId, ttl));
    }

    @Override
    public Map<Long, List<MarketOrder>> sellOrders(long marketId, Duration ttl) {
        return orderBook(marketId, ttl).getSells();
    }

    @Override
    public Map<Long, List<MarketOrder>> buyOrders(long marketId, Duration ttl) {
        return orderBook(marketId, ttl).getBuys();
    }

    @Override
    public ItemInfo itemInfo(long itemId) {
        Optional<ItemInfo> cached = cache.getItem(itemId);
        if (cached.isPresent()) {
            return cached.get();
        }
        return fetchItem(itemId);
    }

    @Override
    public Map<Long, ItemInfo> itemInfoBulk(Collection<Long> itemIds) {
        Map<Long, ItemInfo> result = new LinkedHashMap<>();
        List<Long> toFetch = new ArrayList<>();

        for (Long itemId : itemIds) {
            Optional<ItemInfo> cached = cache.getItem(itemId);
            if (cached.isPresent()) {
                result.put(itemId, cached.get());
            } else {
                toFetch.add(itemId);
            }
        }

        if (!toFetch.isEmpty()) {
            log.info("Resolving metadata for {} items ({} cached)", toFetch.size(), result.size());
        }
        for (int i = 0; i < toFetch.size(); i++) {
            Long itemId = toFetch.get(i);
            result.put(itemId, fetchItem(itemId));
            if (i > 0 && i % 50 == 0) {
                log.debug("Item metadata {}/{}", i, toFetch.size());
            }
        }
        return result;
    }

    @Override
    public List<ItemInfo> searchItems(String query) {
        ApiResponse response = apiClient.searchItems(query);
        List<ItemInfo> results = new ArrayList<>();
        for (Long itemId : jsonMapper.parseSearchHits(response.getBody(), "inventory_type", SEARCH_LIMIT)) {
            results.add(itemInfo(itemId));
        }
        return results;
    }

    @Override
    public Map<Long, BigDecimal> adjustedPrices() {
        return jsonMapper.parseAdjustedPrices(apiClient.getAdjustedPrices().getBody());
    }

    /**
     * Fetch and cache one item. An upstream failure degrades to placeholder metadata,
     * which is cached too but expires on the shorter placeholder TTL.
     */
    private ItemInfo fetchItem(long itemId) {
        ItemInfo info;
        try {
            info = jsonMapper.parseItem(itemId, apiClient.getItem(itemId).getBody());
        } catch (MarketApiException | NumberFormatException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.warn("Metadata lookup for item {} failed, using placeholder: {}", itemId, e.getMessage());
            info = ItemInfo.placeholder(itemId);
        }
        cache.putItem(info);
        return info;
    }
}
