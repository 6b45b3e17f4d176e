package com.haulmarket.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Opportunity {
    long itemId;
    String itemName;
    BigDecimal itemBulk;
    String sourceMarket;
    String destinationMarket;

    BigDecimal buyPrice;  // best sell order in the source market
    BigDecimal sellPrice; // best buy order in the destination market
    long volumeAvailable;

    BigDecimal netProfitPerUnit;
    BigDecimal profitMarginPct;
    BigDecimal totalProfitPotential;

    public Route getRoute() {
        return new Route(sourceMarket, destinationMarket);
    }
}
