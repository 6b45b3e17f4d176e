package com.haulmarket.arb.infra;

public class UpstreamRejectedException extends MarketApiException {

    private final int statusCode;

    public UpstreamRejectedException(String endpoint, int statusCode, String reason) {
        super(endpoint, "Upstream rejected " + endpoint + ": HTTP " + statusCode + " " + reason);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
