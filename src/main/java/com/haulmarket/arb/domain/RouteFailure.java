package com.haulmarket.arb.domain;

import lombok.Value;

@Value
public class RouteFailure {
    Route route;
    String errorType;
    String detail;

    public static RouteFailure of(Route route, Throwable error) {
        return new RouteFailure(route, error.getClass().getSimpleName(), String.valueOf(error.getMessage()));
    }

    public String summaryLine() {
        return route + ": " + errorType + " - " + detail;
    }
}
