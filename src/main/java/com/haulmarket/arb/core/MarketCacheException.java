package com.haulmarket.arb.core;

public class MarketCacheException extends RuntimeException {

    public MarketCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
