package com.crabtrading.backend.exception;

public class MarketDataException extends RuntimeException {

    public enum Kind {
        UNREACHABLE,
        HTTP_ERROR,
        INVALID_RESPONSE,
        MISSING_PRICE
    }

    private final Kind kind;
    private final int statusCode;

    public MarketDataException(Kind kind, String message) {
        super(message);
        this.kind = kind;
        this.statusCode = -1;
    }

    public MarketDataException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = -1;
    }

    public MarketDataException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = Kind.HTTP_ERROR;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
