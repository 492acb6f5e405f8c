package com.flagship.asset_ledger.error;

public class UnauthorizedException extends LedgerException {

    private final String identity;

    public UnauthorizedException(String identity, String reason) {
        super(ErrorCode.UNAUTHORIZED, String.format("Identity '%s' is not authorized: %s", identity, reason));
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }
}
