package com.haulmarket.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One resting order as fetched from the upstream order book. Never patched in place;
 * a refetch replaces the whole page it came from.
 */
@Value
@Builder
public class MarketOrder {
    long orderId;
    long itemId;
    BigDecimal price;
    long volumeRemain;
    Side side;
    long marketId;
    long locationId;

    public boolean isBuy() {
        return side == Side.BUY;
    }

    public enum Side {
        BUY, SELL
    }
}
