package com.haulmarket.arb.core;

import com.haulmarket.arb.config.ArbitrageProperties;
import com.haulmarket.arb.domain.FeeConfig;
import com.haulmarket.arb.domain.Market;
import com.haulmarket.arb.domain.Route;
import com.haulmarket.arb.domain.ScanFilters;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// Frozen at scan start so config edits never leak into a running scan
@Value
public class ScanSnapshot {
    Map<String, Market> markets;
    List<Route> configuredRoutes;
    FeeConfig feeConfig;
    ScanFilters filters;
    Duration orderTtl;
    List<String> validationErrors;

    public static ScanSnapshot from(ArbitrageProperties properties) {
        // Each unordered pair (A, B) is scanned as A -> B and B -> A
        Set<Route> routes = new LinkedHashSet<>();
        for (List<String> pair : properties.getScan().getPairs()) {
            if (ArbitrageProperties.isWellFormedPair(pair)) {
                Route route = new Route(pair.get(0), pair.get(1));
                routes.add(route);
                routes.add(route.reversed());
            }
        }
        return new ScanSnapshot(
                Map.copyOf(properties.marketsByName()),
                List.copyOf(routes),
                properties.toFeeConfig(),
                properties.toScanFilters(),
                properties.getCache().getOrderTtl(),
                List.copyOf(properties.validate()));
    }

    public boolean isValid() {
        return validationErrors.isEmpty();
    }

    public boolean knows(Route route) {
        return route.getSource() != null && route.getDestination() != null
                && markets.containsKey(route.getSource()) && markets.containsKey(route.getDestination());
    }

    public Market market(String name) {
        Market market = markets.get(name);
        if (market == null) {
            throw new IllegalArgumentException("Unknown market: " + name);
        }
        return market;
    }

    public List<Route> distinct(List<Route> routes) {
        return new ArrayList<>(new LinkedHashSet<>(routes));
    }
}
