package com.haulmarket.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ScanFilters {
    BigDecimal minProfitMarginPct;
    BigDecimal minNetProfit;
    BigDecimal maxInvestmentPerItem; // 0 = no cap
    long minVolumeAvailable;
}
