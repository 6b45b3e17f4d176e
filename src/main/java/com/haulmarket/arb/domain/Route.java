package com.haulmarket.arb.domain;

import lombok.Value;

@Value
public class Route {
    // Market names, not ids
    String source;
    String destination;

    public Route reversed() {
        return new Route(destination, source);
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
