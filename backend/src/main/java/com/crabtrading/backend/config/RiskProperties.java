package com.crabtrading.backend.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @Positive
    private double maxAbsPositionPerSymbol = 100.0;

    @Positive
    private double maxDailyLoss = 5000.0;

    /**
     * When enabled a SELL may exceed the held quantity and open a short position.
     */
    private boolean allowShortSelling = false;
}
