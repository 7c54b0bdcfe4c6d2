package com.crabtrading.backend.exception;

/**
 * Typed rejection reasons returned by ledger operations. The wire code is the stable
 * identifier persisted in activity details and surfaced to callers.
 */
public enum LedgerErrorCode {

    AGENT_NOT_FOUND("agent_not_found", Category.NOT_FOUND),
    MARKET_NOT_FOUND("market_not_found", Category.NOT_FOUND),
    REGISTRATION_NOT_FOUND("registration_not_found", Category.NOT_FOUND),

    INSUFFICIENT_CASH("insufficient_cash", Category.INSUFFICIENT_RESOURCE),
    INSUFFICIENT_POSITION("insufficient_position", Category.INSUFFICIENT_RESOURCE),

    RISK_REJECT_MAX_POSITION("risk_reject_max_position", Category.RISK_REJECT),
    RISK_REJECT_MAX_DAILY_LOSS("risk_reject_max_daily_loss", Category.RISK_REJECT),

    AGENT_BLOCKED("agent_blocked", Category.STATE_CONFLICT),
    MARKET_ALREADY_RESOLVED("market_already_resolved", Category.STATE_CONFLICT),
    ALREADY_RESOLVED("already_resolved", Category.STATE_CONFLICT),
    NAME_ALREADY_EXISTS("name_already_exists", Category.STATE_CONFLICT),
    REGISTRATION_EXPIRED("registration_expired", Category.STATE_CONFLICT),

    INVALID_OUTCOME("invalid_outcome", Category.VALIDATION),
    INVALID_WINNING_OUTCOME("invalid_winning_outcome", Category.VALIDATION),
    INVALID_ODDS("invalid_odds", Category.VALIDATION),
    INVALID_AMOUNT("invalid_amount", Category.VALIDATION),
    INVALID_ORDER("invalid_order", Category.VALIDATION),
    INVALID_SYMBOL("invalid_symbol", Category.VALIDATION),
    INVALID_DISPLAY_NAME("invalid_display_name", Category.VALIDATION),

    MARKET_DATA_UNAVAILABLE("market_data_unavailable", Category.UPSTREAM);

    public enum Category {
        NOT_FOUND,
        INSUFFICIENT_RESOURCE,
        RISK_REJECT,
        STATE_CONFLICT,
        VALIDATION,
        UPSTREAM
    }

    private final String code;
    private final Category category;

    LedgerErrorCode(String code, Category category) {
        this.code = code;
        this.category = category;
    }

    public String code() {
        return code;
    }

    public Category category() {
        return category;
    }
}
