// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ledger;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.InstantSource;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.voteledger.NullifierRegistry;
import org.hiero.voteledger.exceptions.DuplicateNullifierException;
import org.hiero.voteledger.exceptions.LedgerStorageException;
import org.hiero.voteledger.impl.store.NullifierStore;
import org.hiero.voteledger.impl.store.NullifierStore.NullifierEvent;
import org.hiero.voteledger.model.NullifierRecord;
import org.hiero.voteledger.model.Scope;
import org.hiero.voteledger.model.VoteEntry;

/**
 * Nullifier registry backed by a {@link NullifierStore}.
 *
 * <p>The commit point of a reservation is the insertion into the in-memory index, which happens at most once per
 * {@code (scope, nullifier)} no matter how many threads race. The winner then records the reservation durably; if
 * that fails the insertion is undone and the caller sees a {@link LedgerStorageException}.</p>
 */
@Singleton
public class NullifierRegistryImpl implements NullifierRegistry {
    private static final Logger log = LogManager.getLogger(NullifierRegistryImpl.class);

    private final NullifierStore store;
    private final InstantSource clock;
    private final Map<String, Map<String, NullifierRecord>> reserved = new ConcurrentHashMap<>();

    @Inject
    public NullifierRegistryImpl(@NonNull final NullifierStore store, @NonNull final InstantSource clock) {
        this.store = requireNonNull(store, "store must not be null");
        this.clock = requireNonNull(clock, "clock must not be null");
        for (final NullifierEvent event : store.load()) {
            final NullifierRecord record = event.record();
            switch (event.type()) {
                case RESERVED -> scopeIndex(record.scope()).put(record.nullifier(), record);
                case RELEASED -> scopeIndex(record.scope()).remove(record.nullifier());
            }
        }
        log.info(
                "Nullifier registry restored with {} reservations in {} scopes",
                reserved.values().stream().mapToLong(Map::size).sum(),
                reserved.size());
    }

    @NonNull
    @Override
    public NullifierRecord reserve(@NonNull final Scope scope, @NonNull final String nullifier) {
        requireNonNull(scope, "scope must not be null");
        requireNonNull(nullifier, "nullifier must not be null");
        return reserveAt(new NullifierRecord(scope, nullifier, clock.instant()));
    }

    /**
     * Reserves a nullifier on behalf of a ledger entry that is about to be journaled. Tagging the reservation with
     * the entry lets a restarting ledger tell a vote that was never written from one that was.
     *
     * @param scope     the scope
     * @param nullifier the nullifier
     * @param entryId   the id of the entry being appended
     * @return the reservation
     * @throws DuplicateNullifierException if the nullifier is already reserved in the scope
     */
    @NonNull
    NullifierRecord reserveForEntry(
            @NonNull final Scope scope, @NonNull final String nullifier, @NonNull final String entryId) {
        requireNonNull(entryId, "entryId must not be null");
        return reserveAt(new NullifierRecord(scope, nullifier, clock.instant(), entryId));
    }

    @Override
    public boolean query(@NonNull final Scope scope, @NonNull final String nullifier) {
        requireNonNull(scope, "scope must not be null");
        requireNonNull(nullifier, "nullifier must not be null");
        final Map<String, NullifierRecord> index = reserved.get(scope.key());
        return index != null && index.containsKey(nullifier);
    }

    @Override
    public long reservedCount(@NonNull final Scope scope) {
        requireNonNull(scope, "scope must not be null");
        final Map<String, NullifierRecord> index = reserved.get(scope.key());
        return index == null ? 0 : index.size();
    }

    /**
     * Undoes a reservation whose vote could not be recorded, so the credential can be used again.
     *
     * @param record the reservation returned by {@link #reserve}
     */
    public void release(@NonNull final NullifierRecord record) {
        requireNonNull(record, "record must not be null");
        final Map<String, NullifierRecord> index = scopeIndex(record.scope());
        if (!index.remove(record.nullifier(), record)) {
            return;
        }
        try {
            store.append(new NullifierEvent(NullifierEvent.Type.RELEASED, record));
        } catch (LedgerStorageException e) {
            // Keeping the credential burned is the safe side of a failed release
            index.put(record.nullifier(), record);
            throw e;
        }
        log.debug("Released nullifier {}… in scope {}", abbreviate(record.nullifier()), record.scope());
    }

    /**
     * Re-reserves the nullifier of an entry found in a ledger journal but missing from the registry.
     *
     * @param scope the scope
     * @param entry the recorded entry
     * @return whether a repair was needed
     */
    boolean repair(@NonNull final Scope scope, @NonNull final VoteEntry entry) {
        if (query(scope, entry.nullifier())) {
            return false;
        }
        try {
            reserveAt(new NullifierRecord(scope, entry.nullifier(), entry.timestamp(), entry.id()));
            return true;
        } catch (DuplicateNullifierException e) {
            return false;
        }
    }

    /**
     * Releases the reservations a ledger made for entries that never reached its journal, as left by a crash
     * between the reservation and the entry write. Reservations made directly through the registry are kept.
     *
     * @param scope            the scope of the ledger
     * @param recordedEntryIds the ids of every entry in the ledger's journal
     * @return the number of reservations released
     */
    int releaseUnrecorded(@NonNull final Scope scope, @NonNull final Set<String> recordedEntryIds) {
        requireNonNull(scope, "scope must not be null");
        requireNonNull(recordedEntryIds, "recordedEntryIds must not be null");
        final Map<String, NullifierRecord> index = reserved.get(scope.key());
        if (index == null) {
            return 0;
        }
        final List<NullifierRecord> orphans = index.values().stream()
                .filter(record -> record.entryId() != null && !recordedEntryIds.contains(record.entryId()))
                .toList();
        orphans.forEach(this::release);
        return orphans.size();
    }

    private NullifierRecord reserveAt(final NullifierRecord record) {
        final String nullifier = record.nullifier();
        final Scope scope = record.scope();
        final Map<String, NullifierRecord> index = scopeIndex(scope);
        if (index.putIfAbsent(nullifier, record) != null) {
            log.warn("Rejected reuse of nullifier {}… in scope {}", abbreviate(nullifier), scope);
            throw new DuplicateNullifierException();
        }
        try {
            store.append(new NullifierEvent(NullifierEvent.Type.RESERVED, record));
        } catch (LedgerStorageException e) {
            index.remove(nullifier, record);
            throw e;
        }
        return record;
    }

    private Map<String, NullifierRecord> scopeIndex(final Scope scope) {
        return reserved.computeIfAbsent(scope.key(), k -> new ConcurrentHashMap<>());
    }

    private static String abbreviate(final String nullifier) {
        return nullifier.substring(0, Math.min(8, nullifier.length() / 2));
    }
}
