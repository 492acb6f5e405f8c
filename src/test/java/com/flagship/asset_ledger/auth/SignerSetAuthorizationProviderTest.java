package com.flagship.asset_ledger.auth;

import com.flagship.asset_ledger.error.ErrorCode;
import com.flagship.asset_ledger.error.UnauthorizedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignerSetAuthorizationProviderTest {

    private final AuthorizationProvider provider = new SignerSetAuthorizationProvider();

    @Test
    @DisplayName("Passes when every required identity co-signed")
    void allSigned() {
        assertDoesNotThrow(() -> provider.requireCoSigners(TransactionSigners.of("A", "B", "C"), "A", "B"));
    }

    @Test
    @DisplayName("Names the first identity that did not sign")
    void missingSigner() {
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
            () -> provider.requireCoSigners(TransactionSigners.of("A"), "A", "B"));

        assertEquals("B", e.getIdentity());
        assertEquals(ErrorCode.UNAUTHORIZED, e.getCode());
    }

    @Test
    @DisplayName("Empty signer set authorizes nobody")
    void noSigners() {
        assertThrows(UnauthorizedException.class,
            () -> provider.requireCoSigners(TransactionSigners.none(), "A"));
    }

    @Test
    @DisplayName("Blank required identity is a programming error")
    void blankIdentity() {
        assertThrows(IllegalArgumentException.class,
            () -> provider.requireCoSigners(TransactionSigners.of("A"), " "));
    }
}
