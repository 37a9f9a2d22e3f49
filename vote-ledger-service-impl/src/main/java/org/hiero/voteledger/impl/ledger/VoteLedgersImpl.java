// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ledger;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.InstantSource;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hiero.voteledger.VoteLedger;
import org.hiero.voteledger.VoteLedgers;
import org.hiero.voteledger.config.LedgerConfig;
import org.hiero.voteledger.impl.store.SnapshotStore;
import org.hiero.voteledger.impl.store.VoteEntryStore;
import org.hiero.voteledger.model.Scope;

/**
 * Opens one {@link MerkleVoteLedger} per scope on first use and keeps it for the lifetime of the registry.
 */
@Singleton
public class VoteLedgersImpl implements VoteLedgers {
    private final LedgerConfig config;
    private final NullifierRegistryImpl nullifiers;
    private final VoteEntryStore entryStore;
    private final SnapshotStore snapshotStore;
    private final InstantSource clock;
    private final Map<Scope, MerkleVoteLedger> ledgers = new ConcurrentHashMap<>();

    @Inject
    public VoteLedgersImpl(
            @NonNull final LedgerConfig config,
            @NonNull final NullifierRegistryImpl nullifiers,
            @NonNull final VoteEntryStore entryStore,
            @NonNull final SnapshotStore snapshotStore,
            @NonNull final InstantSource clock) {
        this.config = requireNonNull(config, "config must not be null");
        this.nullifiers = requireNonNull(nullifiers, "nullifiers must not be null");
        this.entryStore = requireNonNull(entryStore, "entryStore must not be null");
        this.snapshotStore = requireNonNull(snapshotStore, "snapshotStore must not be null");
        this.clock = requireNonNull(clock, "clock must not be null");
    }

    @NonNull
    @Override
    public VoteLedger ledger(@NonNull final Scope scope) {
        requireNonNull(scope, "scope must not be null");
        return ledgers.computeIfAbsent(
                scope, s -> new MerkleVoteLedger(s, config, nullifiers, entryStore, snapshotStore, clock));
    }

    @NonNull
    @Override
    public Optional<VoteLedger> existingLedger(@NonNull final Scope scope) {
        requireNonNull(scope, "scope must not be null");
        if (ledgers.containsKey(scope) || entryStore.scopes().contains(scope)) {
            return Optional.of(ledger(scope));
        }
        return Optional.empty();
    }

    @NonNull
    @Override
    public List<VoteLedger> ledgersFor(@NonNull final String electionId) {
        requireNonNull(electionId, "electionId must not be null");
        return Stream.concat(ledgers.keySet().stream(), entryStore.scopes().stream())
                .filter(scope -> scope.electionId().equals(electionId))
                .distinct()
                .sorted(Comparator.comparing(Scope::key))
                .map(this::ledger)
                .toList();
    }
}
