// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.hiero.voteledger.exceptions.CeremonyAlreadyCompletedException;
import org.hiero.voteledger.exceptions.CeremonyNotFoundException;
import org.hiero.voteledger.exceptions.CeremonyStateException;
import org.hiero.voteledger.exceptions.DuplicateTrusteeSubmissionException;
import org.hiero.voteledger.exceptions.ValidationException;
import org.hiero.voteledger.model.CeremonyProgress;
import org.hiero.voteledger.model.DecryptionCeremony;
import org.hiero.voteledger.model.PartialDecryption;
import org.hiero.voteledger.model.SubmissionOutcome;
import org.hiero.voteledger.model.TallyResult;

/**
 * Orchestrates threshold decryption of an election's votes:
 * {@code PENDING -> IN_PROGRESS -> COMBINING -> COMPLETED}, with {@code ABORTED} reachable while the ceremony is
 * running. The caller must have closed voting before calling {@link #start}.
 */
public interface DecryptionCeremonyCoordinator {

    /**
     * Starts a ceremony, binding the current snapshot of every ledger of the election. Entries appended later are
     * never tallied by this ceremony.
     *
     * @param electionId     the election
     * @param requiredShares the number of distinct trustees needed
     * @return the progress of the new ceremony
     * @throws CeremonyStateException if a ceremony of the election is already running
     * @throws CeremonyAlreadyCompletedException if the election was already tallied
     * @throws ValidationException if {@code requiredShares} is below the configured minimum
     */
    @NonNull
    default CeremonyProgress start(@NonNull final String electionId, final int requiredShares) {
        return start(electionId, requiredShares, Set.of());
    }

    /**
     * Same as {@link #start(String, int)}, restricting the admissible plaintext choices to {@code candidateIds}.
     * Every listed candidate appears in the result, with zero votes if nobody chose it.
     */
    @NonNull
    CeremonyProgress start(@NonNull String electionId, int requiredShares, @NonNull Set<String> candidateIds);

    /**
     * Accepts one trustee's partial decryptions. Partials whose proofs fail are dropped individually; the rest of
     * the submission still counts. Reaching the threshold triggers the tally synchronously.
     *
     * @param electionId the election
     * @param trusteeId  the submitting trustee
     * @param partials   the trustee's partials, at most one per entry
     * @return how many partials were accepted and dropped, and the resulting progress
     * @throws CeremonyNotFoundException if the election has no ceremony
     * @throws CeremonyAlreadyCompletedException if the ceremony is terminal
     * @throws DuplicateTrusteeSubmissionException if the trustee already submitted
     * @throws ValidationException if the trustee is unknown or the submission is malformed
     */
    @NonNull
    SubmissionOutcome submitPartials(
            @NonNull String electionId, @NonNull String trusteeId, @NonNull List<PartialDecryption> partials);

    /**
     * @param electionId the election
     * @return the ceremony's progress; has no side effects
     * @throws CeremonyNotFoundException if the election has no ceremony
     */
    @NonNull
    CeremonyProgress status(@NonNull String electionId);

    /**
     * @param electionId the election
     * @return the tally, present once the ceremony completed
     * @throws CeremonyNotFoundException if the election has no ceremony
     */
    @NonNull
    Optional<TallyResult> result(@NonNull String electionId);

    /**
     * @param electionId the election
     * @return the audit view of the latest ceremony
     * @throws CeremonyNotFoundException if the election has no ceremony
     */
    @NonNull
    DecryptionCeremony ceremony(@NonNull String electionId);

    /**
     * @param electionId the election
     * @return every ceremony attempt of the election, oldest first
     */
    @NonNull
    List<DecryptionCeremony> history(@NonNull String electionId);

    /**
     * Aborts a running ceremony. Its partials are retained; a new {@link #start} is needed to retry.
     *
     * @param electionId the election
     * @param reason     why the ceremony is aborted
     * @return the progress after the abort
     * @throws CeremonyNotFoundException if the election has no ceremony
     * @throws CeremonyStateException if the ceremony is not running
     */
    @NonNull
    CeremonyProgress abort(@NonNull String electionId, @NonNull String reason);

    /**
     * Aborts every running ceremony whose deadline has passed.
     *
     * @return the ids of the elections whose ceremonies were aborted
     */
    @NonNull
    List<String> abortExpired();
}
