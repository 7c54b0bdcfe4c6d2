package com.crabtrading.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class MarketDataResilienceConfig {

    @Bean
    public CircuitBreaker marketDataCircuitBreaker(
            @Value("${market-data.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${market-data.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${market-data.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreaker.of("market-data", config);
    }

    @Bean
    public Retry marketDataRetry(
            @Value("${market-data.resilience.retry.max-attempts:2}") int maxAttempts,
            @Value("${market-data.resilience.retry.base-delay-ms:200}") long baseDelayMs,
            @Value("${market-data.resilience.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("market-data", config);
    }
}
