// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ledger;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.security.MessageDigest;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.voteledger.VoteLedger;
import org.hiero.voteledger.config.LedgerConfig;
import org.hiero.voteledger.exceptions.InvalidPositionException;
import org.hiero.voteledger.exceptions.LedgerEmptyException;
import org.hiero.voteledger.exceptions.ValidationException;
import org.hiero.voteledger.hashing.LedgerHashing;
import org.hiero.voteledger.impl.store.SnapshotStore;
import org.hiero.voteledger.impl.store.VoteEntryStore;
import org.hiero.voteledger.model.AppendResult;
import org.hiero.voteledger.model.Hash;
import org.hiero.voteledger.model.InclusionProof;
import org.hiero.voteledger.model.LedgerEntry;
import org.hiero.voteledger.model.LedgerSnapshot;
import org.hiero.voteledger.model.NullifierRecord;
import org.hiero.voteledger.model.Scope;
import org.hiero.voteledger.model.VoteEntry;

/**
 * A {@link VoteLedger} over a {@link MerkleAccumulator}, persisted in a {@link VoteEntryStore}.
 *
 * <p>Appends are serialized by a write lock and run in the order validate, reserve the nullifier, persist the
 * entry, extend the tree. A failure after the reservation releases it again, so a vote is either fully recorded
 * or leaves no trace. A crash between the two writes is undone when the ledger is reopened: the reservation names
 * its entry, and reservations whose entry is missing from the journal are released. Reads share a read lock and
 * so always see a completed append.</p>
 */
public class MerkleVoteLedger implements VoteLedger {
    private static final Logger log = LogManager.getLogger(MerkleVoteLedger.class);

    private final Scope scope;
    private final LedgerConfig config;
    private final NullifierRegistryImpl nullifiers;
    private final VoteEntryStore entryStore;
    private final SnapshotStore snapshotStore;
    private final InstantSource clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final MessageDigest digest = LedgerHashing.newMessageDigest();
    private final MerkleAccumulator accumulator = new MerkleAccumulator(digest);
    private final List<VoteEntry> entries = new ArrayList<>();
    private final Map<String, Integer> positionsByNullifier = new HashMap<>();
    private final Map<String, Integer> positionsById = new HashMap<>();

    /**
     * Opens the ledger of a scope, replaying its stored entries.
     */
    public MerkleVoteLedger(
            @NonNull final Scope scope,
            @NonNull final LedgerConfig config,
            @NonNull final NullifierRegistryImpl nullifiers,
            @NonNull final VoteEntryStore entryStore,
            @NonNull final SnapshotStore snapshotStore,
            @NonNull final InstantSource clock) {
        this.scope = requireNonNull(scope, "scope must not be null");
        this.config = requireNonNull(config, "config must not be null");
        this.nullifiers = requireNonNull(nullifiers, "nullifiers must not be null");
        this.entryStore = requireNonNull(entryStore, "entryStore must not be null");
        this.snapshotStore = requireNonNull(snapshotStore, "snapshotStore must not be null");
        this.clock = requireNonNull(clock, "clock must not be null");
        restore();
    }

    private void restore() {
        int repaired = 0;
        for (final VoteEntry entry : entryStore.load(scope)) {
            if (nullifiers.repair(scope, entry)) {
                repaired++;
            }
            record(entry);
        }
        if (repaired > 0) {
            log.warn("Re-reserved {} nullifiers of recorded entries missing from the registry in {}", repaired, scope);
        }
        final int released = nullifiers.releaseUnrecorded(scope, positionsById.keySet());
        if (released > 0) {
            log.warn("Released {} nullifiers reserved for entries that were never recorded in {}", released, scope);
        }
        log.info(
                "Opened ledger {} with {} entries and root {}",
                scope,
                accumulator.leafCount(),
                accumulator.rootHash());
    }

    @NonNull
    @Override
    public Scope scope() {
        return scope;
    }

    @NonNull
    @Override
    public AppendResult append(@NonNull final VoteEntry entry) {
        requireNonNull(entry, "entry must not be null");
        final Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            validate(entry);
            final NullifierRecord reservation = nullifiers.reserveForEntry(scope, entry.nullifier(), entry.id());
            try {
                entryStore.append(scope, entry);
            } catch (RuntimeException e) {
                nullifiers.release(reservation);
                throw e;
            }
            final long position = record(entry);
            log.debug("Appended entry at position {} of {}", position, scope);
            return new AppendResult(position, accumulator.proof(position));
        } finally {
            writeLock.unlock();
        }
    }

    @NonNull
    @Override
    public InclusionProof getProof(final long position) {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            if (accumulator.leafCount() == 0) {
                throw new LedgerEmptyException("Ledger " + scope + " has no entries");
            }
            checkPosition(position);
            return accumulator.proof(position);
        } finally {
            readLock.unlock();
        }
    }

    @NonNull
    @Override
    public Hash getRoot() {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return accumulator.rootHash();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public long getVoteCount() {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return accumulator.leafCount();
        } finally {
            readLock.unlock();
        }
    }

    @NonNull
    @Override
    public LedgerSnapshot getSnapshot() {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return new LedgerSnapshot(scope, accumulator.rootHash(), accumulator.leafCount(), clock.instant());
        } finally {
            readLock.unlock();
        }
    }

    @NonNull
    @Override
    public LedgerSnapshot publishSnapshot() {
        final LedgerSnapshot snapshot = getSnapshot();
        snapshotStore.append(snapshot);
        log.info("Published snapshot of {}: {} votes, root {}", scope, snapshot.voteCount(), snapshot.root());
        return snapshot;
    }

    @NonNull
    @Override
    public List<LedgerSnapshot> publishedSnapshots() {
        return snapshotStore.load(scope);
    }

    @NonNull
    @Override
    public Hash rootAt(final long voteCount) {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            if (voteCount < 0 || voteCount > accumulator.leafCount()) {
                throw new InvalidPositionException(
                        "Ledger " + scope + " never held " + voteCount + " entries");
            }
            return accumulator.rootAt(voteCount);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean isHistoricalRoot(@NonNull final Hash root) {
        requireNonNull(root, "root must not be null");
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return accumulator.isHistoricalRoot(root);
        } finally {
            readLock.unlock();
        }
    }

    @NonNull
    @Override
    public VoteEntry getEntry(final long position) {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            checkPosition(position);
            return entries.get((int) position);
        } finally {
            readLock.unlock();
        }
    }

    @NonNull
    @Override
    public Optional<LedgerEntry> findByNullifier(@NonNull final String nullifier) {
        requireNonNull(nullifier, "nullifier must not be null");
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            final Integer position = positionsByNullifier.get(nullifier);
            return position == null
                    ? Optional.empty()
                    : Optional.of(new LedgerEntry(position, entries.get(position)));
        } finally {
            readLock.unlock();
        }
    }

    @NonNull
    @Override
    public List<VoteEntry> entries(final long count) {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            if (count < 0 || count > entries.size()) {
                throw new InvalidPositionException(
                        "Ledger " + scope + " has " + entries.size() + " entries, " + count + " requested");
            }
            return List.copyOf(entries.subList(0, (int) count));
        } finally {
            readLock.unlock();
        }
    }

    private long record(final VoteEntry entry) {
        final int position = entries.size();
        entries.add(entry);
        positionsByNullifier.put(entry.nullifier(), position);
        positionsById.put(entry.id(), position);
        return accumulator.addLeaf(LedgerHashing.leafHash(digest, entry));
    }

    private void checkPosition(final long position) {
        if (position < 0 || position >= accumulator.leafCount()) {
            throw new InvalidPositionException(
                    "Position " + position + " outside [0, " + accumulator.leafCount() + ") of ledger " + scope);
        }
    }

    private void validate(final VoteEntry entry) {
        requireField("id", entry.id(), config.maxIdLength());
        requireField("encryptedVote", entry.encryptedVote(), config.maxEncryptedVoteLength());
        requireField("commitment", entry.commitment(), config.maxCommitmentLength());
        requireField("zkProof", entry.zkProof(), config.maxZkProofLength());
        requireField("nullifier", entry.nullifier(), config.maxNullifierLength());
        if (positionsById.containsKey(entry.id())) {
            throw new ValidationException("Entry id " + entry.id() + " is already recorded");
        }
    }

    private static void requireField(final String name, final String value, final int maxLength) {
        if (value.isBlank()) {
            throw new ValidationException(name + " must not be blank");
        }
        if (value.length() > maxLength) {
            throw new ValidationException(name + " exceeds " + maxLength + " characters");
        }
    }
}
