// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * The full, audit-level view of one attempt at decrypting an election's votes.
 *
 * @param electionId     the election being tallied
 * @param attempt        1 for the first ceremony of the election, incremented on every retry after an abort
 * @param status         the current phase
 * @param requiredShares the number of distinct trustees needed
 * @param boundSnapshots the snapshot of every scope of the election captured at start
 * @param candidateIds   the expected candidates, empty if any plaintext choice is admissible
 * @param submittedTrustees trustees that have made their one submission, in arrival order
 * @param partials       every partial received, valid or dropped
 * @param startedAt      when the ceremony started
 * @param deadline       when an unfinished ceremony times out
 * @param abortReason    why the ceremony was aborted, if it was
 * @param result         the tally, present only when {@link CeremonyStatus#COMPLETED}
 */
public record DecryptionCeremony(
        @NonNull String electionId,
        int attempt,
        @NonNull CeremonyStatus status,
        int requiredShares,
        @NonNull List<LedgerSnapshot> boundSnapshots,
        @NonNull Set<String> candidateIds,
        @NonNull List<String> submittedTrustees,
        @NonNull List<RecordedPartial> partials,
        @NonNull Instant startedAt,
        @NonNull Instant deadline,
        @Nullable String abortReason,
        @Nullable TallyResult result) {
    public DecryptionCeremony {
        requireNonNull(electionId, "electionId must not be null");
        requireNonNull(status, "status must not be null");
        boundSnapshots = List.copyOf(requireNonNull(boundSnapshots, "boundSnapshots must not be null"));
        candidateIds = Set.copyOf(requireNonNull(candidateIds, "candidateIds must not be null"));
        submittedTrustees = List.copyOf(requireNonNull(submittedTrustees, "submittedTrustees must not be null"));
        partials = List.copyOf(requireNonNull(partials, "partials must not be null"));
        requireNonNull(startedAt, "startedAt must not be null");
        requireNonNull(deadline, "deadline must not be null");
    }

    /**
     * @return the total number of entries the ceremony decrypts
     */
    public long boundVoteCount() {
        return boundSnapshots.stream().mapToLong(LedgerSnapshot::voteCount).sum();
    }

    /**
     * @return the number of distinct trustees with at least one validated partial
     */
    public int validTrusteeCount() {
        return (int) partials.stream()
                .filter(RecordedPartial::valid)
                .map(p -> p.partial().trusteeId())
                .distinct()
                .count();
    }

    /**
     * @return the summary reported by {@code status()}
     */
    @NonNull
    public CeremonyProgress progress() {
        return new CeremonyProgress(validTrusteeCount(), requiredShares, status);
    }
}
