package com.crabtrading.backend.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "market-data")
@Data
@Validated
public class MarketDataProperties {

    private Alpaca alpaca = new Alpaca();
    private Polymarket polymarket = new Polymarket();

    @Data
    public static class Alpaca {
        @NotBlank
        private String dataBaseUrl = "https://data.alpaca.markets";

        private String apiKey = "";
        private String apiSecret = "";

        @NotBlank
        private String stockFeed = "iex";
    }

    @Data
    public static class Polymarket {
        @NotBlank
        private String gammaBaseUrl = "https://gamma-api.polymarket.com";
    }
}
