package com.haulmarket.arb.domain;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class CachedPage {
    long marketId;
    int page;
    // Reported by the upstream alongside page 1; kept so a cached page 1 still knows the book size
    int totalPages;
    Instant fetchedAt;
    List<MarketOrder> orders;
}
