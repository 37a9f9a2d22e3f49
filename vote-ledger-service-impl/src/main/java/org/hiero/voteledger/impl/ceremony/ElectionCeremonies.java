// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ceremony;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.hiero.voteledger.impl.store.CeremonyStore;
import org.hiero.voteledger.model.DecryptionCeremony;
import org.hiero.voteledger.model.VoteEntry;

/**
 * The attempts of one election's ceremony and the lock serializing changes to them.
 *
 * <p>Every change is saved before it is published, and published by replacing an immutable list, so readers
 * that skip the lock see either the old or the new attempts.</p>
 */
class ElectionCeremonies {
    private final String electionId;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile List<DecryptionCeremony> attempts;

    /** Entries bound by the latest attempt, by entry id in ledger order; guarded by {@link #lock}. */
    @Nullable
    private Map<String, VoteEntry> boundEntries;

    ElectionCeremonies(@NonNull final String electionId, @NonNull final List<DecryptionCeremony> attempts) {
        this.electionId = requireNonNull(electionId);
        this.attempts = List.copyOf(attempts);
    }

    @NonNull
    ReentrantLock lock() {
        return lock;
    }

    @NonNull
    String electionId() {
        return electionId;
    }

    @Nullable
    DecryptionCeremony latest() {
        final List<DecryptionCeremony> current = attempts;
        return current.isEmpty() ? null : current.get(current.size() - 1);
    }

    @NonNull
    List<DecryptionCeremony> attempts() {
        return attempts;
    }

    /**
     * Saves and publishes a new attempt. Must hold the lock.
     */
    void addAttempt(
            @NonNull final CeremonyStore store,
            @NonNull final DecryptionCeremony attempt,
            @NonNull final Map<String, VoteEntry> entries) {
        final List<DecryptionCeremony> updated = new ArrayList<>(attempts);
        updated.add(attempt);
        publish(store, updated);
        boundEntries = entries;
    }

    /**
     * Saves and publishes a new version of the latest attempt. Must hold the lock.
     */
    void replaceLatest(@NonNull final CeremonyStore store, @NonNull final DecryptionCeremony latest) {
        final List<DecryptionCeremony> updated = new ArrayList<>(attempts);
        updated.set(updated.size() - 1, latest);
        publish(store, updated);
    }

    @Nullable
    Map<String, VoteEntry> boundEntries() {
        return boundEntries;
    }

    void setBoundEntries(@NonNull final Map<String, VoteEntry> entries) {
        this.boundEntries = entries;
    }

    private void publish(final CeremonyStore store, final List<DecryptionCeremony> updated) {
        store.save(electionId, updated);
        attempts = List.copyOf(updated);
    }
}
