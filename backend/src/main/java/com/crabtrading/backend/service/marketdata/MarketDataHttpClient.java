package com.crabtrading.backend.service.marketdata;

import com.crabtrading.backend.exception.MarketDataException;
import com.crabtrading.backend.service.LedgerMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * GET client shared by the market data feeds. Calls go through retry and the circuit breaker,
 * and every failure surfaces as a {@link MarketDataException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataHttpClient {

    private final RestTemplate marketDataRestTemplate;
    private final CircuitBreaker marketDataCircuitBreaker;
    private final Retry marketDataRetry;
    private final LedgerMetrics ledgerMetrics;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    void init() {
        marketDataCircuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Market data circuit {} -> {}",
                        event.getStateTransition().getFromState(), event.getStateTransition().getToState()));
        Gauge.builder("market_data_circuit_state", marketDataCircuitBreaker, breaker -> mapState(breaker.getState()))
                .register(meterRegistry);
    }

    public String get(String feed, String url, Map<String, String> headers) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        Supplier<String> supplier = () -> doRequest(url, headers);
        try {
            Supplier<String> decorated = Retry.decorateSupplier(marketDataRetry, supplier);
            decorated = CircuitBreaker.decorateSupplier(marketDataCircuitBreaker, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            recordFailure(feed, url, null, "CIRCUIT_OPEN", e);
            throw new MarketDataException(MarketDataException.Kind.UNREACHABLE, feed + " circuit breaker open", e);
        } catch (ResourceAccessException e) {
            recordFailure(feed, url, null, "UNREACHABLE", e);
            throw new MarketDataException(MarketDataException.Kind.UNREACHABLE, feed + " unreachable: " + e.getMessage(), e);
        } catch (HttpServerErrorException | HttpClientErrorException e) {
            int status = e.getStatusCode().value();
            recordFailure(feed, url, status, "HTTP_ERROR", e);
            throw new MarketDataException(feed + " returned HTTP " + status, status, e);
        } catch (MarketDataException e) {
            recordFailure(feed, url, null, e.getKind().name(), e);
            throw e;
        } catch (RestClientException e) {
            recordFailure(feed, url, null, "UNREACHABLE", e);
            throw new MarketDataException(MarketDataException.Kind.UNREACHABLE, feed + " request failed: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("market_data_call_latency")
                    .tag("feed", feed)
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(String url, Map<String, String> headers) {
        HttpHeaders httpHeaders = new HttpHeaders();
        httpHeaders.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.forEach(httpHeaders::set);
        ResponseEntity<String> response = marketDataRestTemplate.exchange(
                url, HttpMethod.GET, new HttpEntity<>(httpHeaders), String.class);
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new MarketDataException(MarketDataException.Kind.INVALID_RESPONSE, "Empty response from " + url);
        }
        return body;
    }

    private int mapState(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> 0;
            case OPEN -> 1;
            case HALF_OPEN -> 2;
            default -> 3;
        };
    }

    private void recordFailure(String feed, String url, Integer status, String reason, Exception e) {
        log.warn("Market data request failed feed={} url={} status={} reason={} message={}",
                feed, url, status, reason, e.getMessage());
        ledgerMetrics.recordFeedFailure(feed, reason);
    }
}
