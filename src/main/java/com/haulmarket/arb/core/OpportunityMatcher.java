package com.haulmarket.arb.core;

import com.haulmarket.arb.domain.BestPrice;
import com.haulmarket.arb.domain.FeeConfig;
import com.haulmarket.arb.domain.ItemInfo;
import com.haulmarket.arb.domain.Market;
import com.haulmarket.arb.domain.MarketOrder;
import com.haulmarket.arb.domain.Opportunity;
import com.haulmarket.arb.domain.ProfitResult;
import com.haulmarket.arb.domain.ScanFilters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds items that can be bought from sell orders in a source market and sold into buy
 * orders in a destination market at a profit after fees and transport.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpportunityMatcher {

    public static final Comparator<Opportunity> BY_TOTAL_PROFIT_DESC =
            Comparator.comparing(Opportunity::getTotalProfitPotential).reversed();

    private final MarketDataSource dataSource;

    /**
     * @return accepted opportunities, highest total profit potential first
     */
    public List<Opportunity> findOpportunities(Market source, Market destination,
                                               FeeConfig fees, ScanFilters filters, Duration ttl) {
        log.info("Fetching sell orders from {}...", source.getName());
        Map<Long, List<MarketOrder>> sourceSells = dataSource.sellOrders(source.getId(), ttl);

        log.info("Fetching buy orders from {}...", destination.getName());
        Map<Long, List<MarketOrder>> destBuys = dataSource.buyOrders(destination.getId(), ttl);

        // Only items with sell orders at the source and buy orders at the destination
        Set<Long> commonItemIds = new TreeSet<>(sourceSells.keySet());
        commonItemIds.retainAll(destBuys.keySet());
        log.info("Analysing {} common items for {} -> {}", commonItemIds.size(), source.getName(),
                destination.getName());

        List<Candidate> candidates = new ArrayList<>();
        for (Long itemId : commonItemIds) {
            priceCandidate(itemId, sourceSells.get(itemId), destBuys.get(itemId), filters)
                    .ifPresent(candidates::add);
        }

        // Metadata is resolved for price-filter survivors only, not for every common item
        List<Long> candidateIds = new ArrayList<>(candidates.size());
        candidates.forEach(c -> candidateIds.add(c.itemId));
        Map<Long, ItemInfo> itemInfo = dataSource.itemInfoBulk(candidateIds);

        List<Opportunity> opportunities = new ArrayList<>();
        for (Candidate candidate : candidates) {
            ItemInfo info = itemInfo.getOrDefault(candidate.itemId, ItemInfo.placeholder(candidate.itemId));
            ProfitResult profit = FeeModel.profit(candidate.buyPrice, candidate.sellPrice, info.getBulk(), fees);

            if (!FeeModel.isProfitable(profit.getNetProfit(), profit.getMarginPct(),
                    filters.getMinProfitMarginPct(), filters.getMinNetProfit())) {
                continue;
            }

            opportunities.add(Opportunity.builder()
                    .itemId(candidate.itemId)
                    .itemName(info.getName())
                    .itemBulk(info.getBulk())
                    .sourceMarket(source.getName())
                    .destinationMarket(destination.getName())
                    .buyPrice(candidate.buyPrice)
                    .sellPrice(candidate.sellPrice)
                    .volumeAvailable(candidate.volumeAvailable)
                    .netProfitPerUnit(profit.getNetProfit())
                    .profitMarginPct(profit.getMarginPct())
                    .totalProfitPotential(profit.getNetProfit().multiply(BigDecimal.valueOf(candidate.volumeAvailable)))
                    .build());
        }

        opportunities.sort(BY_TOTAL_PROFIT_DESC);
        log.info("{} -> {}: {} opportunities from {} priced candidates", source.getName(), destination.getName(),
                opportunities.size(), candidates.size());
        return opportunities;
    }

    /**
     * Applies the price and volume filters that need no item metadata.
     */
    private Optional<Candidate> priceCandidate(long itemId, List<MarketOrder> sells, List<MarketOrder> buys,
                                               ScanFilters filters) {
        Optional<BestPrice> ask = BestPriceSelector.bestSell(sells); // we buy at this price
        Optional<BestPrice> bid = BestPriceSelector.bestBuy(buys);   // we sell at this price
        if (ask.isEmpty() || bid.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal buyPrice = ask.get().getPrice();
        BigDecimal sellPrice = bid.get().getPrice();
        long available = ask.get().getVolume();

        if (available < filters.getMinVolumeAvailable()) {
            return Optional.empty();
        }
        BigDecimal maxInvestment = filters.getMaxInvestmentPerItem();
        if (maxInvestment != null && maxInvestment.signum() > 0 && buyPrice.compareTo(maxInvestment) > 0) {
            return Optional.empty();
        }
        return Optional.of(new Candidate(itemId, buyPrice, sellPrice, available));
    }

    private static final class Candidate {
        private final long itemId;
        private final BigDecimal buyPrice;
        private final BigDecimal sellPrice;
        private final long volumeAvailable;

        private Candidate(long itemId, BigDecimal buyPrice, BigDecimal sellPrice, long volumeAvailable) {
            this.itemId = itemId;
            this.buyPrice = buyPrice;
            this.sellPrice = sellPrice;
            this.volumeAvailable = volumeAvailable;
        }
    }
}
