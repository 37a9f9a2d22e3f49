// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Instant;

/**
 * A single recorded vote. Immutable once created; only {@code id}, {@code encryptedVote}, {@code commitment} and
 * {@code nullifier} contribute to the leaf hash.
 *
 * @param id            unique entry id
 * @param encryptedVote the ballot ciphertext, opaque to the ledger
 * @param commitment    hiding commitment to the vote choice
 * @param zkProof       proof of ballot validity, opaque to the ledger
 * @param nullifier     one-time token derived from the voting credential
 * @param timestamp     when the vote was accepted
 */
public record VoteEntry(
        @NonNull String id,
        @NonNull String encryptedVote,
        @NonNull String commitment,
        @NonNull String zkProof,
        @NonNull String nullifier,
        @NonNull Instant timestamp) {
    public VoteEntry {
        requireNonNull(id, "id must not be null");
        requireNonNull(encryptedVote, "encryptedVote must not be null");
        requireNonNull(commitment, "commitment must not be null");
        requireNonNull(zkProof, "zkProof must not be null");
        requireNonNull(nullifier, "nullifier must not be null");
        requireNonNull(timestamp, "timestamp must not be null");
    }
}
