package com.haulmarket.arb.domain;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ProfitResult {
    BigDecimal netProfit;
    BigDecimal marginPct;
}
