package com.haulmarket.arb.domain;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class BestPrice {
    BigDecimal price;
    long volume;
}
