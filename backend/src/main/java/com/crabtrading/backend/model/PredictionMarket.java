package com.crabtrading.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionMarket {

    private String marketId;
    private String question;

    @Builder.Default
    private Map<String, Double> outcomes = new LinkedHashMap<>();

    private boolean resolved;
    private String winningOutcome;
    private String source;

    public Double odds(String outcome) {
        return outcomes.get(outcome);
    }
}
