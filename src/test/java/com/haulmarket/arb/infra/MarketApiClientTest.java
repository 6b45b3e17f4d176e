package com.haulmarket.arb.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.haulmarket.arb.config.ArbitrageProperties;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarketApiClientTest {

    private static final MediaType JSON = MediaType.get("application/json");

    private final Deque<Step> script = new ArrayDeque<>();
    private final List<Request> requests = new ArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();

    private MarketApiClient client;

    @FunctionalInterface
    private interface Step {
        Response respond(Request request) throws IOException;
    }

    @BeforeEach
    void setUp() {
        ArbitrageProperties properties = new ArbitrageProperties();
        properties.getApi().setBaseUrl("http://market.test/latest");
        properties.getApi().setRequestsPerSecond(0);

        OkHttpClient http = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    requests.add(chain.request());
                    Step step = script.poll();
                    if (step == null) {
                        throw new IllegalStateException("No scripted response left for " + chain.request().url());
                    }
                    return step.respond(chain.request());
                })
                .build();

        client = new MarketApiClient(http, new ObjectMapper(), properties, sleeps::add);
    }

    @Test
    void returnsParsedBodyAndHeadersOnSuccess() {
        script.add(reply(200, "[{\"type_id\":34,\"price\":5.5}]", "X-Pages", "3"));

        ApiResponse response = client.getOrderPage(10000002L, 1);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getBody().get(0).path("type_id").asLong()).isEqualTo(34L);
        assertThat(response.intHeader("X-Pages", 1)).isEqualTo(3);
        assertThat(sleeps).isEmpty();

        Request sent = requests.get(0);
        assertThat(sent.url().encodedPath()).isEqualTo("/latest/markets/10000002/orders/");
        assertThat(sent.url().queryParameter("datasource")).isEqualTo("tranquility");
        assertThat(sent.url().queryParameter("order_type")).isEqualTo("all");
        assertThat(sent.url().queryParameter("page")).isEqualTo("1");
        assertThat(sent.header("User-Agent")).isEqualTo("haulmarket-arb/1.0");
    }

    @Test
    void missingPagesHeaderFallsBackToDefault() {
        script.add(reply(200, "[]"));

        assertThat(client.getOrderPage(1L, 1).intHeader("X-Pages", 1)).isEqualTo(1);
    }

    @Test
    void retriesTransientStatusesWithExponentialBackoff() {
        script.add(reply(503, ""));
        script.add(reply(502, ""));
        script.add(reply(200, "{\"name\":\"Tritanium\"}"));

        ApiResponse response = client.getItem(34L);

        assertThat(response.getBody().path("name").asText()).isEqualTo("Tritanium");
        assertThat(requests).hasSize(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void connectionFailuresExhaustAttempts() {
        for (int i = 0; i < 3; i++) {
            script.add(request -> {
                throw new ConnectException("connection refused");
            });
        }

        assertThatThrownBy(() -> client.getItem(34L))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("/universe/types/34/")
                .hasRootCauseInstanceOf(ConnectException.class)
                .satisfies(e -> assertThat(((FetchFailedException) e).getAttempts()).isEqualTo(3));

        assertThat(requests).hasSize(3);
        // no sleep after the final attempt
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void gatewayTimeoutOnEveryAttemptFails() {
        script.add(reply(504, ""));
        script.add(reply(504, ""));
        script.add(reply(504, ""));

        assertThatThrownBy(() -> client.getAdjustedPrices())
                .isInstanceOf(FetchFailedException.class);
        assertThat(requests).hasSize(3);
    }

    @Test
    void otherErrorStatusesAreNotRetried() {
        script.add(reply(404, "{\"error\":\"Type not found!\"}"));

        assertThatThrownBy(() -> client.getItem(99999999L))
                .isInstanceOf(UpstreamRejectedException.class)
                .satisfies(e -> assertThat(((UpstreamRejectedException) e).getStatusCode()).isEqualTo(404));

        assertThat(requests).hasSize(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void internalServerErrorIsNotTransient() {
        script.add(reply(500, ""));

        assertThatThrownBy(() -> client.getAdjustedPrices())
                .isInstanceOf(UpstreamRejectedException.class);
        assertThat(requests).hasSize(1);
    }

    @Test
    void coolsDownWhenErrorBudgetRunsLow() {
        script.add(reply(200, "[]", "X-ESI-Error-Limit-Remain", "5"));

        client.getAdjustedPrices();

        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
        assertThat(client.getErrorLimitRemain()).isEqualTo(5);
        assertThat(client.getCooldownCount()).isEqualTo(1);
    }

    @Test
    void noCoolDownAtThreshold() {
        script.add(reply(200, "[]", "X-ESI-Error-Limit-Remain", "20"));

        client.getAdjustedPrices();

        assertThat(sleeps).isEmpty();
        assertThat(client.getErrorLimitRemain()).isEqualTo(20);
    }

    @Test
    void errorResponsesAlsoReportBudget() {
        script.add(reply(404, "", "X-ESI-Error-Limit-Remain", "3"));

        assertThatThrownBy(() -> client.getItem(1L)).isInstanceOf(UpstreamRejectedException.class);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void malformedJsonIsRejected() {
        script.add(reply(200, "{not json"));

        assertThatThrownBy(() -> client.getAdjustedPrices())
                .isInstanceOf(MarketApiException.class)
                .isNotInstanceOf(FetchFailedException.class);
    }

    @Test
    void searchSendsQueryParameters() {
        script.add(reply(200, "{\"inventory_type\":[34,35]}"));

        client.searchItems("trit");

        Request sent = requests.get(0);
        assertThat(sent.url().queryParameter("search")).isEqualTo("trit");
        assertThat(sent.url().queryParameter("categories")).isEqualTo("inventory_type");
        assertThat(sent.url().queryParameter("strict")).isEqualTo("false");
    }

    private static Step reply(int code, String body, String... headers) {
        return request -> new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("HTTP " + code)
                .headers(Headers.of(headers))
                .body(ResponseBody.create(body, JSON))
                .build();
    }
}
