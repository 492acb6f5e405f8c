package com.flagship.asset_ledger.error;

/**
 * Base type for the typed failures of ledger operations.
 *
 * All subclasses are unchecked so that a throw inside a
 * {@code @Transactional} method rolls the whole unit back.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode code;

    protected LedgerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
