// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A blind-signed voting credential as presented with a vote.
 *
 * @param electionId the election the credential was issued for
 * @param nullifier  the credential's one-time token
 * @param message    the signed message
 * @param signature  the unblinded signature over {@code message}
 */
public record Credential(
        @NonNull String electionId, @NonNull String nullifier, @NonNull String message, @NonNull String signature) {
    public Credential {
        requireNonNull(electionId, "electionId must not be null");
        requireNonNull(nullifier, "nullifier must not be null");
        requireNonNull(message, "message must not be null");
        requireNonNull(signature, "signature must not be null");
    }
}
