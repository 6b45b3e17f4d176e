package com.haulmarket.arb.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.haulmarket.arb.config.ArbitrageProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP access to the upstream market API.
 *
 * <p>Transient failures (connection errors, 502/503/504) are retried with exponential
 * backoff; any other non-2xx status is surfaced immediately. After every response the
 * upstream error budget header is inspected and the client cools down when it runs low.
 * One instance is shared by all scan workers.
 */
@Slf4j
@Service
public class MarketApiClient {

    private static final Set<Integer> TRANSIENT_STATUS = Set.of(502, 503, 504);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ArbitrageProperties.Api settings;
    private final Sleeper sleeper;
    private final RequestRateLimiter rateLimiter;

    // Last error budget the upstream reported; -1 until a response carried the header
    private final AtomicInteger errorLimitRemain = new AtomicInteger(-1);
    private final AtomicInteger cooldownCount = new AtomicInteger();

    public MarketApiClient(OkHttpClient marketHttpClient,
                           ObjectMapper objectMapper,
                           ArbitrageProperties properties,
                           Sleeper sleeper) {
        this.httpClient = marketHttpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getApi();
        this.sleeper = sleeper;
        this.rateLimiter = new RequestRateLimiter(settings.getRequestsPerSecond(), sleeper);
    }

    public ApiResponse getOrderPage(long marketId, int page) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("order_type", "all");
        params.put("page", String.valueOf(page));
        return fetch("/markets/" + marketId + "/orders/", params);
    }

    public ApiResponse getItem(long itemId) {
        return fetch("/universe/types/" + itemId + "/", Map.of("language", "en"));
    }

    public ApiResponse searchItems(String query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("categories", "inventory_type");
        params.put("language", "en");
        params.put("search", query);
        params.put("strict", "false");
        return fetch("/search/", params);
    }

    public ApiResponse getAdjustedPrices() {
        return fetch("/markets/prices/", Map.of());
    }

    /**
     * GET {@code endpoint} relative to the configured base URL.
     *
     * @throws UpstreamRejectedException on a non-retryable status
     * @throws FetchFailedException when every attempt failed transiently
     */
    public ApiResponse fetch(String endpoint, Map<String, String> params) {
        Request request = new Request.Builder()
                .url(buildUrl(endpoint, params))
                .header("User-Agent", settings.getUserAgent())
                .header("Accept", "application/json")
                .build();

        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        Exception lastError = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            boolean lastAttempt = attempt == maxAttempts - 1;
            try {
                rateLimiter.acquire();
                try (Response response = httpClient.newCall(request).execute()) {
                    checkErrorBudget(response);
                    int code = response.code();
                    if (response.isSuccessful()) {
                        ResponseBody body = response.body();
                        String payload = body != null ? body.string() : "";
                        return toApiResponse(endpoint, code, payload, response.headers());
                    }
                    if (!TRANSIENT_STATUS.contains(code)) {
                        throw new UpstreamRejectedException(endpoint, code, response.message());
                    }
                    log.warn("Transient HTTP {} from {} (attempt {}/{})", code, endpoint, attempt + 1, maxAttempts);
                    lastError = new IOException("HTTP " + code);
                } catch (IOException e) {
                    log.warn("Connection failure on {} (attempt {}/{}): {}", endpoint, attempt + 1, maxAttempts,
                            e.getMessage());
                    lastError = e;
                }
                if (!lastAttempt) {
                    sleeper.sleep(Duration.ofSeconds(1L << attempt));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchFailedException(endpoint, attempt + 1, e);
            }
        }
        throw new FetchFailedException(endpoint, maxAttempts, lastError);
    }

    public int getErrorLimitRemain() {
        return errorLimitRemain.get();
    }

    public int getCooldownCount() {
        return cooldownCount.get();
    }

    private HttpUrl buildUrl(String endpoint, Map<String, String> params) {
        HttpUrl base = HttpUrl.parse(settings.getBaseUrl() + endpoint);
        if (base == null) {
            throw new IllegalArgumentException("Invalid upstream URL: " + settings.getBaseUrl() + endpoint);
        }
        HttpUrl.Builder builder = base.newBuilder()
                .addQueryParameter("datasource", settings.getDatasource());
        params.forEach(builder::addQueryParameter);
        return builder.build();
    }

    private ApiResponse toApiResponse(String endpoint, int code, String payload, Headers headers) {
        JsonNode json = NullNode.getInstance();
        if (!payload.isBlank()) {
            try {
                json = objectMapper.readTree(payload);
            } catch (JsonProcessingException e) {
                throw new MarketApiException(endpoint, "Malformed JSON from " + endpoint, e);
            }
        }
        return new ApiResponse(code, payload, json, headers);
    }

    private void checkErrorBudget(Response response) throws InterruptedException {
        String header = response.header(settings.getErrorLimitHeader());
        if (header == null) {
            return;
        }
        int remain;
        try {
            remain = Integer.parseInt(header.trim());
        } catch (NumberFormatException e) {
            return;
        }
        errorLimitRemain.set(remain);
        if (remain < settings.getErrorLimitThreshold()) {
            cooldownCount.incrementAndGet();
            log.info("Upstream error budget low ({} left), cooling down for {} ms", remain,
                    settings.getErrorLimitCooldown().toMillis());
            sleeper.sleep(settings.getErrorLimitCooldown());
        }
    }
}
