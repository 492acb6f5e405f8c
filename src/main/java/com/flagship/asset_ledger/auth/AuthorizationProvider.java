package com.flagship.asset_ledger.auth;

import com.flagship.asset_ledger.error.UnauthorizedException;

/**
 * Confirms that the identities a transaction depends on actually authorized it.
 */
public interface AuthorizationProvider {

    /**
     * Requires every given identity to be a co-signer of the transaction.
     *
     * @throws UnauthorizedException naming the first identity that did not sign
     */
    void requireCoSigners(TransactionSigners signers, String... identities);
}
