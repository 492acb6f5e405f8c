package com.flagship.asset_ledger.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionSignersTest {

    @Test
    @DisplayName("Header value is split on commas and trimmed")
    void parseSplitsAndTrims() {
        TransactionSigners signers = TransactionSigners.parse(" A , B,,C ");

        assertTrue(signers.hasSigned("A"));
        assertTrue(signers.hasSigned("B"));
        assertTrue(signers.hasSigned("C"));
        assertEquals(3, signers.getIdentities().size());
    }

    @Test
    @DisplayName("Missing or blank header means nobody signed")
    void parseBlank() {
        assertTrue(TransactionSigners.parse(null).isEmpty());
        assertTrue(TransactionSigners.parse("   ").isEmpty());
        assertFalse(TransactionSigners.parse(null).hasSigned("A"));
    }

    @Test
    @DisplayName("Null identity is never a signer")
    void nullIdentityHasNotSigned() {
        assertFalse(TransactionSigners.of("A").hasSigned(null));
    }

    @Test
    @DisplayName("Signer set is read-only")
    void identitiesAreUnmodifiable() {
        TransactionSigners signers = TransactionSigners.of("A");

        assertThrows(UnsupportedOperationException.class, () -> signers.getIdentities().add("B"));
    }
}
