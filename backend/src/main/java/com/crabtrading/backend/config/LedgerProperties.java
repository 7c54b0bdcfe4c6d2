package com.crabtrading.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Data
@Validated
public class LedgerProperties {

    @Positive
    private double startingCash = 2000.0;

    @Min(1)
    private int activityLogCapacity = 5000;

    private State state = new State();
    private Registration registration = new Registration();
    private MarkToMarket markToMarket = new MarkToMarket();
    private Markets markets = new Markets();
    private Seed seed = new Seed();

    @Data
    public static class State {
        /**
         * Plain JSON state file written by the pre-database deployment. Read once when the
         * database holds no snapshot.
         */
        private String legacyFile = "data/ledger_state.json";

        /**
         * Refuse to start instead of starting empty when the stored snapshot is unreadable.
         */
        private boolean failOnCorruptSnapshot = false;

        /**
         * Directory that receives a copy of an unreadable snapshot before the ledger starts empty.
         */
        private String quarantineDir = "data/quarantine";
    }

    @Data
    public static class Registration {
        @Min(1)
        private long challengeTtlSeconds = 900;

        /**
         * When false, issuing a registration creates the account immediately.
         */
        private boolean requireClaim = false;
    }

    @Data
    public static class MarkToMarket {
        private boolean enabled = true;

        @Min(1)
        private long refreshSeconds = 300;

        @Min(1000)
        private long pollIntervalMs = 60000;

        @Min(1)
        private int maxSymbols = 60;
    }

    @Data
    public static class Markets {
        @Min(1)
        private int listLimit = 100;

        @NotBlank
        private String defaultSource = "polymarket";
    }

    @Data
    public static class Seed {
        private Map<String, Double> prices = new LinkedHashMap<>();
        private List<SeedMarket> markets = new ArrayList<>();
    }

    @Data
    public static class SeedMarket {
        private String marketId;
        private String question;
        private Map<String, Double> outcomes = new LinkedHashMap<>();
    }
}
