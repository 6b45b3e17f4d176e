package com.haulmarket.arb.domain;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Value
public class SplitOrderBook {
    Map<Long, List<MarketOrder>> sells;
    Map<Long, List<MarketOrder>> buys;

    public static SplitOrderBook of(List<MarketOrder> orders) {
        Map<Long, List<MarketOrder>> sells = new HashMap<>();
        Map<Long, List<MarketOrder>> buys = new HashMap<>();
        for (MarketOrder order : orders) {
            Map<Long, List<MarketOrder>> side = order.isBuy() ? buys : sells;
            side.computeIfAbsent(order.getItemId(), k -> new ArrayList<>()).add(order);
        }
        return new SplitOrderBook(Collections.unmodifiableMap(sells), Collections.unmodifiableMap(buys));
    }
}
