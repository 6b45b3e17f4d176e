package com.haulmarket.arb.infra;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;
import okhttp3.Headers;

@Value
public class ApiResponse {
    int status;
    String rawBody;
    JsonNode body;
    Headers headers;

    public int intHeader(String name, int defaultValue) {
        String value = headers.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
