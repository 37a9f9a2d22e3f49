// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ceremony;

import static java.util.Objects.requireNonNull;
import static org.hiero.voteledger.model.CeremonyStatus.ABORTED;
import static org.hiero.voteledger.model.CeremonyStatus.COMBINING;
import static org.hiero.voteledger.model.CeremonyStatus.COMPLETED;
import static org.hiero.voteledger.model.CeremonyStatus.IN_PROGRESS;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hiero.voteledger.model.CeremonyStatus;
import org.hiero.voteledger.model.PartialDecryption;

/**
 * State machine logic for the phases of a decryption ceremony.
 */
@Singleton
public class CeremonyStateMachine {

    @Inject
    public CeremonyStateMachine() {
        // Dagger2
    }

    /**
     * Represents a transition of the ceremony state machine; may be a no-op transition, and always is if the
     * event triggering it was not accepted (e.g., because it arrived in the wrong phase or was a duplicate).
     * @param accepted whether the event triggering the transition was accepted
     * @param newStatus the status after the transition
     */
    public record Transition(boolean accepted, @NonNull CeremonyStatus newStatus) {
        public Transition {
            requireNonNull(newStatus);
        }

        public static Transition rejectedAt(@NonNull final CeremonyStatus currentStatus) {
            return new Transition(false, currentStatus);
        }

        public static Transition incorporatedIn(@NonNull final CeremonyStatus currentStatus) {
            return new Transition(true, currentStatus);
        }

        public static Transition advanceTo(@NonNull final CeremonyStatus newStatus) {
            return new Transition(true, newStatus);
        }

        /**
         * @param before the status before the transition
         * @return whether the transition changed the status
         */
        public boolean advancedFrom(@NonNull final CeremonyStatus before) {
            return accepted && newStatus != before;
        }
    }

    /**
     * Computes the next status given a trustee submission whose partials were already validated.
     * <p>
     * <b>Important:</b> On acceptance, has the side effect of recording the trustee as submitted and adding its
     * valid partials to {@code partialsByEntry}.
     * @param trusteeId the submitting trustee
     * @param validPartials the trustee's partials that passed validation, possibly none
     * @param currentStatus the current status
     * @param requiredShares the number of distinct trustees needed
     * @param submittedTrustees the trustees that already made their submission
     * @param partialsByEntry valid partials so far, by entry id and then trustee id
     * @return the transition
     */
    public Transition onSubmission(
            @NonNull final String trusteeId,
            @NonNull final List<PartialDecryption> validPartials,
            @NonNull final CeremonyStatus currentStatus,
            final int requiredShares,
            @NonNull final Set<String> submittedTrustees,
            @NonNull final Map<String, SortedMap<String, PartialDecryption>> partialsByEntry) {
        requireNonNull(trusteeId);
        requireNonNull(validPartials);
        requireNonNull(currentStatus);
        requireNonNull(submittedTrustees);
        requireNonNull(partialsByEntry);
        if (currentStatus != IN_PROGRESS) {
            return Transition.rejectedAt(currentStatus);
        }
        // First submission wins, even one whose partials were all dropped
        if (!submittedTrustees.add(trusteeId)) {
            return Transition.rejectedAt(currentStatus);
        }
        for (final var partial : validPartials) {
            partialsByEntry
                    .computeIfAbsent(partial.entryId(), id -> new TreeMap<>())
                    .putIfAbsent(trusteeId, partial);
        }
        if (distinctTrustees(partialsByEntry.values()).size() >= requiredShares) {
            return Transition.advanceTo(COMBINING);
        }
        return Transition.incorporatedIn(currentStatus);
    }

    /**
     * @param currentStatus the current status, expected to be {@code COMBINING}
     * @param succeeded whether the tally produced a result
     * @return the transition
     */
    public Transition onTallyOutcome(@NonNull final CeremonyStatus currentStatus, final boolean succeeded) {
        requireNonNull(currentStatus);
        if (currentStatus != COMBINING) {
            return Transition.rejectedAt(currentStatus);
        }
        return Transition.advanceTo(succeeded ? COMPLETED : ABORTED);
    }

    /**
     * @param currentStatus the current status
     * @return the transition; only a running ceremony can be aborted
     */
    public Transition onAbort(@NonNull final CeremonyStatus currentStatus) {
        requireNonNull(currentStatus);
        if (currentStatus != IN_PROGRESS && currentStatus != COMBINING) {
            return Transition.rejectedAt(currentStatus);
        }
        return Transition.advanceTo(ABORTED);
    }

    /**
     * @param partialsByTrustee valid partials, each map keyed by trustee id
     * @return the sorted ids of every trustee with at least one valid partial
     */
    public static Set<String> distinctTrustees(
            @NonNull final Collection<? extends Map<String, PartialDecryption>> partialsByTrustee) {
        final Set<String> trustees = new TreeSet<>();
        partialsByTrustee.forEach(byTrustee -> trustees.addAll(byTrustee.keySet()));
        return trustees;
    }
}
