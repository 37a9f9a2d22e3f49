// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A ballot (or one question of a ballot) as submitted by a voter's client.
 *
 * @param electionId    the election voted in
 * @param questionId    the question answered, {@code null} for single-question ballots
 * @param credential    the voting credential
 * @param encryptedVote the encrypted choice
 * @param commitment    commitment to the choice
 * @param zkProof       proof that the encrypted choice is well formed
 */
public record VoteSubmission(
        @NonNull String electionId,
        @Nullable String questionId,
        @NonNull Credential credential,
        @NonNull String encryptedVote,
        @NonNull String commitment,
        @NonNull String zkProof) {
    public VoteSubmission {
        requireNonNull(electionId, "electionId must not be null");
        requireNonNull(credential, "credential must not be null");
        requireNonNull(encryptedVote, "encryptedVote must not be null");
        requireNonNull(commitment, "commitment must not be null");
        requireNonNull(zkProof, "zkProof must not be null");
    }
}
