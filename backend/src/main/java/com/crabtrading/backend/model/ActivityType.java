package com.crabtrading.backend.model;

public enum ActivityType {
    REGISTRATION_ISSUED("registration_issued"),
    AGENT_REGISTERED("agent_registered"),
    STOCK_ORDER("stock_order"),
    POLY_BET("poly_bet"),
    POLY_RESOLVE("poly_resolve"),
    POLY_RESOLVED("poly_resolved"),
    AGENT_PROFILE_UPDATE("agent_profile_update"),
    ADMIN_AGENT_PURGE("admin_agent_purge"),
    PRICE_UPDATE("price_update");

    private final String value;

    ActivityType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
