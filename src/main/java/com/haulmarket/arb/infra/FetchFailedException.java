package com.haulmarket.arb.infra;

public class FetchFailedException extends MarketApiException {

    private final int attempts;

    public FetchFailedException(String endpoint, int attempts, Throwable cause) {
        super(endpoint, "Failed to GET " + endpoint + " after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
