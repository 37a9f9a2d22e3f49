// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Instant;
import java.util.List;

/**
 * The published outcome of a completed decryption ceremony.
 *
 * @param candidates            per-candidate counts, most votes first
 * @param totalVotes            the number of entries decrypted, equal to the bound snapshot's vote count
 * @param completedAt           when the tally was produced
 * @param participatingTrustees trustees with at least one validated partial, sorted
 */
public record TallyResult(
        @NonNull List<CandidateTally> candidates,
        long totalVotes,
        @NonNull Instant completedAt,
        @NonNull List<String> participatingTrustees) {
    public TallyResult {
        candidates = List.copyOf(requireNonNull(candidates, "candidates must not be null"));
        requireNonNull(completedAt, "completedAt must not be null");
        participatingTrustees =
                List.copyOf(requireNonNull(participatingTrustees, "participatingTrustees must not be null"));
    }

    /**
     * @param candidateId the candidate
     * @return the candidate's votes, zero if the candidate is not listed
     */
    public long votesFor(@NonNull final String candidateId) {
        return candidates.stream()
                .filter(c -> c.candidateId().equals(candidateId))
                .mapToLong(CandidateTally::votes)
                .findFirst()
                .orElse(0L);
    }
}
