package com.flagship.asset_ledger.auth;

import lombok.Value;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Identities the host asserted as co-signers of one request.
 *
 * Signature verification happens upstream; by the time a request reaches the
 * ledger the signer set is trusted input.
 */
@Value
public class TransactionSigners {

    public static final String HEADER = "X-Signers";

    Set<String> identities;

    private TransactionSigners(Set<String> identities) {
        this.identities = Collections.unmodifiableSet(identities);
    }

    public static TransactionSigners of(Collection<String> identities) {
        Set<String> cleaned = identities.stream()
            .filter(id -> id != null && !id.isBlank())
            .map(String::trim)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return new TransactionSigners(cleaned);
    }

    public static TransactionSigners of(String... identities) {
        return of(Arrays.asList(identities));
    }

    /**
     * Parses the comma separated {@value #HEADER} header value.
     */
    public static TransactionSigners parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return none();
        }
        return of(headerValue.split(","));
    }

    public static TransactionSigners none() {
        return new TransactionSigners(Set.of());
    }

    public boolean hasSigned(String identity) {
        return identity != null && identities.contains(identity);
    }

    public boolean isEmpty() {
        return identities.isEmpty();
    }
}
