package com.flagship.solid_ledger.token;

/**
 * Business rejection of a ledger operation. The operation has been rolled back.
 */
public class LedgerException extends RuntimeException {

    private final ErrorCode code;

    public LedgerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
