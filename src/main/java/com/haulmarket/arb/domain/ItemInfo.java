package com.haulmarket.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ItemInfo {
    public static final BigDecimal DEFAULT_BULK = BigDecimal.ONE;

    long itemId;
    String name;
    BigDecimal bulk; // per-unit volume, drives transport cost
    boolean placeholder;

    /**
     * Degraded metadata used when the upstream lookup fails.
     */
    public static ItemInfo placeholder(long itemId) {
        return ItemInfo.builder()
                .itemId(itemId)
                .name("Item " + itemId)
                .bulk(DEFAULT_BULK)
                .placeholder(true)
                .build();
    }
}
