package com.crabtrading.backend.service.marketdata;

import com.crabtrading.backend.exception.MarketDataException;
import com.crabtrading.backend.service.LedgerMetrics;
import com.github.tomakehurst.wiremock.WireMockServer;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.client.UnknownHttpStatusCodeException;

import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MarketDataHttpClientTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    private SimpleMeterRegistry meterRegistry;
    private CircuitBreaker circuitBreaker;
    private MarketDataHttpClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        meterRegistry = new SimpleMeterRegistry();
        circuitBreaker = CircuitBreaker.of("test", CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .build());
        client = new MarketDataHttpClient(new RestTemplate(), circuitBreaker, retry,
                new LedgerMetrics(meterRegistry), meterRegistry);
        client.init();
    }

    @Test
    void retriesServerErrorsUntilSuccess() {
        wireMock.stubFor(get(urlEqualTo("/flaky")).inScenario("flaky")
                .whenScenarioStateIs(STARTED)
                .willReturn(serverError())
                .willSetStateTo("recovered"));
        wireMock.stubFor(get(urlEqualTo("/flaky")).inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(okJson("{\"ok\":true}")));

        String body = client.get("test", url("/flaky"), Map.of("X-Feed-Key", "1"));

        assertThat(body).isEqualTo("{\"ok\":true}");
        wireMock.verify(2, getRequestedFor(urlEqualTo("/flaky")).withHeader("X-Feed-Key", equalTo("1")));
        assertThat(meterRegistry.get("market_data_call_latency").tag("status", "success").timer().count()).isEqualTo(1);
    }

    @Test
    void clientErrorsAreNotRetried() {
        wireMock.stubFor(get(urlEqualTo("/missing")).willReturn(notFound()));

        assertThatThrownBy(() -> client.get("test", url("/missing"), Map.of()))
                .isInstanceOfSatisfying(MarketDataException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(MarketDataException.Kind.HTTP_ERROR);
                    assertThat(e.getStatusCode()).isEqualTo(404);
                });
        wireMock.verify(1, getRequestedFor(urlEqualTo("/missing")));
        assertThat(meterRegistry.get("market_data_failures_total").tag("kind", "HTTP_ERROR").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void emptyBodyIsInvalidResponse() {
        wireMock.stubFor(get(urlEqualTo("/empty")).willReturn(ok("")));

        assertThatThrownBy(() -> client.get("test", url("/empty"), Map.of()))
                .isInstanceOfSatisfying(MarketDataException.class,
                        e -> assertThat(e.getKind()).isEqualTo(MarketDataException.Kind.INVALID_RESPONSE));
    }

    @Test
    void openCircuitShortCircuitsCalls() {
        wireMock.stubFor(get(urlEqualTo("/down")).willReturn(notFound()));
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> client.get("test", url("/down"), Map.of()))
                    .isInstanceOf(MarketDataException.class);
        }
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> client.get("test", url("/down"), Map.of()))
                .isInstanceOfSatisfying(MarketDataException.class,
                        e -> assertThat(e.getKind()).isEqualTo(MarketDataException.Kind.UNREACHABLE));
        wireMock.verify(2, getRequestedFor(urlEqualTo("/down")));
        assertThat(meterRegistry.get("market_data_circuit_state").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void unmappedClientFailureIsUnreachable() {
        RestTemplate restTemplate = mock(RestTemplate.class);
        when(restTemplate.exchange(anyString(), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new UnknownHttpStatusCodeException(599, "Odd", new HttpHeaders(), new byte[0], null));
        MarketDataHttpClient failing = new MarketDataHttpClient(restTemplate, circuitBreaker,
                Retry.of("odd", RetryConfig.custom().maxAttempts(1).build()), new LedgerMetrics(meterRegistry), meterRegistry);

        assertThatThrownBy(() -> failing.get("test", url("/odd"), Map.of()))
                .isInstanceOfSatisfying(MarketDataException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(MarketDataException.Kind.UNREACHABLE);
                    assertThat(e.getCause()).isInstanceOf(UnknownHttpStatusCodeException.class);
                });
        assertThat(meterRegistry.get("market_data_failures_total").tag("kind", "UNREACHABLE").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("market_data_call_latency").tag("status", "error").timer().count()).isEqualTo(1);
    }

    private String url(String path) {
        return "http://localhost:" + wireMock.port() + path;
    }
}
