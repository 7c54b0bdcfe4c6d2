package com.crabtrading.backend.exception;

public class LedgerRejectedException extends RuntimeException {
    private final LedgerErrorCode errorCode;

    public LedgerRejectedException(LedgerErrorCode errorCode) {
        super(errorCode.code());
        this.errorCode = errorCode;
    }

    public LedgerRejectedException(LedgerErrorCode errorCode, String message) {
        super(errorCode.code() + ": " + message);
        this.errorCode = errorCode;
    }

    public LedgerErrorCode getErrorCode() {
        return errorCode;
    }
}
