package com.haulmarket.arb.infra;

public class MarketApiException extends RuntimeException {

    private final String endpoint;

    public MarketApiException(String endpoint, String message) {
        super(message);
        this.endpoint = endpoint;
    }

    public MarketApiException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
