package com.haulmarket.arb.core;

import com.haulmarket.arb.domain.BestPrice;
import com.haulmarket.arb.domain.MarketOrder;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Top-of-book selection. Sorting is stable, so ties resolve to the first order in
 * fetch order.
 */
public final class BestPriceSelector {

    private BestPriceSelector() {
    }

    /**
     * Lowest sell order: the price a buyer pays.
     */
    public static Optional<BestPrice> bestSell(List<MarketOrder> sellOrders) {
        return best(sellOrders, Comparator.comparing(MarketOrder::getPrice));
    }

    /**
     * Highest buy order: the price a seller receives.
     */
    public static Optional<BestPrice> bestBuy(List<MarketOrder> buyOrders) {
        return best(buyOrders, Comparator.comparing(MarketOrder::getPrice).reversed());
    }

    private static Optional<BestPrice> best(List<MarketOrder> orders, Comparator<MarketOrder> order) {
        if (orders == null || orders.isEmpty()) {
            return Optional.empty();
        }
        MarketOrder top = orders.stream().sorted(order).findFirst().orElseThrow();
        return Optional.of(new BestPrice(top.getPrice(), top.getVolumeRemain()));
    }
}
