package com.haulmarket.arb.domain;

import lombok.Value;

@Value
public class Market {
    String name;
    long id;
}
