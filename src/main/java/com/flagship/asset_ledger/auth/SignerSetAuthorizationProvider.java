package com.flagship.asset_ledger.auth;

import com.flagship.asset_ledger.error.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Authorization against the signer set asserted by the host.
 */
@Component
@Slf4j
public class SignerSetAuthorizationProvider implements AuthorizationProvider {

    @Override
    public void requireCoSigners(TransactionSigners signers, String... identities) {
        if (signers == null) {
            throw new IllegalArgumentException("Signers cannot be null");
        }
        for (String identity : identities) {
            if (identity == null || identity.isBlank()) {
                throw new IllegalArgumentException("Co-signer identity is required");
            }
            if (!signers.hasSigned(identity)) {
                log.warn("Missing co-signature: identity={}, signers={}", identity, signers.getIdentities());
                throw new UnauthorizedException(identity, "did not co-sign the transaction");
            }
        }
    }
}
