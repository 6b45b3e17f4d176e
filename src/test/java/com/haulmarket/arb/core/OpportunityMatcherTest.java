package com.haulmarket.arb.core;

import com.haulmarket.arb.domain.FeeConfig;
import com.haulmarket.arb.domain.ItemInfo;
import com.haulmarket.arb.domain.Market;
import com.haulmarket.arb.domain.MarketOrder;
import com.haulmarket.arb.domain.Opportunity;
import com.haulmarket.arb.domain.ScanFilters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpportunityMatcherTest {

    private static final Market FORGE = new Market("The Forge", 10000002L);
    private static final Market DOMAIN = new Market("Domain", 10000043L);
    private static final Duration TTL = Duration.ofMinutes(5);

    private static final FeeConfig FEES = FeeConfig.builder()
            .brokerFeeBuy(new BigDecimal("0.03"))
            .brokerFeeSell(new BigDecimal("0.03"))
            .salesTax(new BigDecimal("0.08"))
            .transportCostPerBulkUnit(new BigDecimal("10"))
            .build();

    @Mock
    private MarketDataSource dataSource;

    @Captor
    private ArgumentCaptor<Collection<Long>> requestedIds;

    private OpportunityMatcher matcher;

    private final Map<Long, List<MarketOrder>> forgeSells = new HashMap<>();
    private final Map<Long, List<MarketOrder>> domainBuys = new HashMap<>();
    private final Map<Long, ItemInfo> items = new HashMap<>();

    @BeforeEach
    void setUp() {
        matcher = new OpportunityMatcher(dataSource);
        lenient().when(dataSource.sellOrders(eq(FORGE.getId()), any())).thenReturn(forgeSells);
        lenient().when(dataSource.buyOrders(eq(DOMAIN.getId()), any())).thenReturn(domainBuys);
        lenient().when(dataSource.itemInfoBulk(anyCollection())).thenAnswer(invocation -> {
            Collection<Long> ids = invocation.getArgument(0);
            Map<Long, ItemInfo> result = new LinkedHashMap<>();
            for (Long id : ids) {
                result.put(id, items.getOrDefault(id, ItemInfo.builder()
                        .itemId(id).name("Item " + id).bulk(BigDecimal.ONE).build()));
            }
            return result;
        });
    }

    @Test
    void findsProfitableTradeWithExpectedFigures() {
        sell(34L, "100", 50);
        buy(34L, "150", 30);
        items.put(34L, ItemInfo.builder().itemId(34L).name("Tritanium").bulk(BigDecimal.ONE).build());

        List<Opportunity> found = matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("10", "5", "0", 1), TTL);

        assertThat(found).hasSize(1);
        Opportunity opp = found.get(0);
        assertThat(opp.getItemName()).isEqualTo("Tritanium");
        assertThat(opp.getSourceMarket()).isEqualTo("The Forge");
        assertThat(opp.getDestinationMarket()).isEqualTo("Domain");
        assertThat(opp.getBuyPrice()).isEqualByComparingTo("100");
        assertThat(opp.getSellPrice()).isEqualByComparingTo("150");
        // volume is the best sell order's remaining quantity
        assertThat(opp.getVolumeAvailable()).isEqualTo(50);
        assertThat(opp.getNetProfitPerUnit()).isEqualByComparingTo("20.5");
        assertThat(opp.getProfitMarginPct()).isCloseTo(new BigDecimal("19.90"), within(new BigDecimal("0.01")));
        assertThat(opp.getTotalProfitPotential()).isEqualByComparingTo("1025");
    }

    @Test
    void usesCheapestAskAndHighestBid() {
        sell(34L, "120", 500);
        sell(34L, "100", 50);
        buy(34L, "130", 5);
        buy(34L, "150", 30);

        Opportunity opp = matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "0", "0", 1), TTL).get(0);

        assertThat(opp.getBuyPrice()).isEqualByComparingTo("100");
        assertThat(opp.getSellPrice()).isEqualByComparingTo("150");
        assertThat(opp.getVolumeAvailable()).isEqualTo(50);
    }

    @Test
    void onlyItemsOnBothSidesAreConsidered() {
        sell(1L, "100", 10);
        sell(2L, "100", 10);
        buy(2L, "200", 10);
        buy(3L, "200", 10);

        List<Opportunity> found = matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "0", "0", 1), TTL);

        assertThat(found).extracting(Opportunity::getItemId).containsExactly(2L);
        verify(dataSource).itemInfoBulk(requestedIds.capture());
        assertThat(requestedIds.getValue()).containsExactly(2L);
    }

    @Test
    void noCommonItemsMeansNoOpportunities() {
        sell(1L, "100", 10);
        buy(3L, "200", 10);

        assertThat(matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "0", "0", 1), TTL)).isEmpty();
    }

    @Test
    void thinBestAskIsFilteredByMinVolume() {
        sell(34L, "100", 3);
        sell(34L, "101", 1000);
        buy(34L, "200", 100);

        assertThat(matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "0", "0", 5), TTL)).isEmpty();
        assertThat(matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "0", "0", 3), TTL)).hasSize(1);
    }

    @Test
    void maxInvestmentCapsBuyPriceAndZeroMeansUnlimited() {
        sell(34L, "100", 10);
        buy(34L, "200", 10);

        assertThat(matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "0", "99.99", 1), TTL)).isEmpty();
        assertThat(matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "0", "100", 1), TTL)).hasSize(1);
        assertThat(matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "0", "0", 1), TTL)).hasSize(1);
    }

    @Test
    void heavyItemsLoseToTransportCost() {
        sell(34L, "100", 10);
        buy(34L, "150", 10);
        items.put(34L, ItemInfo.builder().itemId(34L).name("Container").bulk(new BigDecimal("3")).build());

        // net 0.5 per unit once 30 of transport is paid
        assertThat(matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "1", "0", 1), TTL)).isEmpty();
    }

    @Test
    void resultsAreOrderedByTotalProfitPotential() {
        sell(1L, "100", 10);   // 20.5 * 10
        buy(1L, "150", 10);
        sell(2L, "100", 100);  // 20.5 * 100
        buy(2L, "150", 10);
        sell(3L, "1000", 10);  // larger per unit
        buy(3L, "1500", 10);

        List<Opportunity> found = matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", "0", "0", 1), TTL);

        assertThat(found).extracting(Opportunity::getItemId).containsExactly(3L, 2L, 1L);
    }

    @Test
    void raisingThresholdsNeverAddsOpportunities() {
        sell(1L, "100", 10);
        buy(1L, "150", 10);
        sell(2L, "100", 10);
        buy(2L, "120", 10);
        sell(3L, "100", 10);
        buy(3L, "400", 10);
        sell(4L, "100", 10);
        buy(4L, "105", 10);

        int previous = Integer.MAX_VALUE;
        for (String margin : List.of("0", "5", "10", "20", "50", "100", "500")) {
            int count = matcher.findOpportunities(FORGE, DOMAIN, FEES, filters(margin, "0", "0", 1), TTL).size();
            assertThat(count).isLessThanOrEqualTo(previous);
            previous = count;
        }

        List<Integer> byNet = new ArrayList<>();
        for (String minNet : List.of("0", "10", "50", "200")) {
            byNet.add(matcher.findOpportunities(FORGE, DOMAIN, FEES, filters("0", minNet, "0", 1), TTL).size());
        }
        assertThat(byNet).isSortedAccordingTo((a, b) -> Integer.compare(b, a));
    }

    private void sell(long itemId, String price, long volume) {
        forgeSells.computeIfAbsent(itemId, k -> new ArrayList<>()).add(order(itemId, price, volume, MarketOrder.Side.SELL));
    }

    private void buy(long itemId, String price, long volume) {
        domainBuys.computeIfAbsent(itemId, k -> new ArrayList<>()).add(order(itemId, price, volume, MarketOrder.Side.BUY));
    }

    private static MarketOrder order(long itemId, String price, long volume, MarketOrder.Side side) {
        return MarketOrder.builder()
                .orderId(itemId * 1000 + volume)
                .itemId(itemId)
                .price(new BigDecimal(price))
                .volumeRemain(volume)
                .side(side)
                .build();
    }

    private static ScanFilters filters(String minMargin, String minNet, String maxInvestment, long minVolume) {
        return ScanFilters.builder()
                .minProfitMarginPct(new BigDecimal(minMargin))
                .minNetProfit(new BigDecimal(minNet))
                .maxInvestmentPerItem(new BigDecimal(maxInvestment))
                .minVolumeAvailable(minVolume)
                .build();
    }
}
