// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Optional;
import org.hiero.voteledger.exceptions.DuplicateNullifierException;
import org.hiero.voteledger.exceptions.InvalidPositionException;
import org.hiero.voteledger.exceptions.LedgerEmptyException;
import org.hiero.voteledger.exceptions.ValidationException;
import org.hiero.voteledger.hashing.InclusionProofs;
import org.hiero.voteledger.model.AppendResult;
import org.hiero.voteledger.model.Hash;
import org.hiero.voteledger.model.InclusionProof;
import org.hiero.voteledger.model.LedgerEntry;
import org.hiero.voteledger.model.LedgerSnapshot;
import org.hiero.voteledger.model.Scope;
import org.hiero.voteledger.model.VoteEntry;

/**
 * An append-only Merkle ledger of the votes of one {@link Scope}.
 *
 * <p>Every read reflects the most recently completed append; a reader never observes a partially applied append.
 * Proofs are verified with {@link InclusionProofs#verify(InclusionProof)}, which needs no ledger.</p>
 */
public interface VoteLedger {

    /**
     * @return the scope this ledger records votes for
     */
    @NonNull
    Scope scope();

    /**
     * Appends an entry, reserving its nullifier in the same indivisible operation. Either both the reservation
     * and the append take effect, or neither does.
     *
     * @param entry the entry
     * @return the new entry's position and inclusion proof
     * @throws ValidationException if the entry is malformed
     * @throws DuplicateNullifierException if the entry's nullifier is already reserved in this scope
     */
    @NonNull
    AppendResult append(@NonNull VoteEntry entry);

    /**
     * @param position the entry position
     * @return the inclusion proof of the entry against the current root
     * @throws LedgerEmptyException if the ledger has no entries
     * @throws InvalidPositionException if {@code position} is outside {@code [0, voteCount)}
     */
    @NonNull
    InclusionProof getProof(long position);

    /**
     * @return the current root, {@link Hash#EMPTY} for an empty ledger
     */
    @NonNull
    Hash getRoot();

    /**
     * @return the number of entries
     */
    long getVoteCount();

    /**
     * @return the current root and vote count, stamped with the current time
     */
    @NonNull
    LedgerSnapshot getSnapshot();

    /**
     * Records the current snapshot durably so it can be anchored externally.
     *
     * @return the published snapshot
     */
    @NonNull
    LedgerSnapshot publishSnapshot();

    /**
     * @return every snapshot published for this ledger, oldest first
     */
    @NonNull
    List<LedgerSnapshot> publishedSnapshots();

    /**
     * @param voteCount a vote count in {@code [0, getVoteCount()]}
     * @return the root the ledger had when it held exactly {@code voteCount} entries
     * @throws InvalidPositionException if the ledger never had that many entries
     */
    @NonNull
    Hash rootAt(long voteCount);

    /**
     * @param root a root named by a proof or snapshot
     * @return whether this ledger ever had that root
     */
    boolean isHistoricalRoot(@NonNull Hash root);

    /**
     * @param position the entry position
     * @return the entry
     * @throws InvalidPositionException if {@code position} is outside {@code [0, voteCount)}
     */
    @NonNull
    VoteEntry getEntry(long position);

    /**
     * @param nullifier the nullifier of a credential
     * @return the entry cast with that credential, if any
     */
    @NonNull
    Optional<LedgerEntry> findByNullifier(@NonNull String nullifier);

    /**
     * @param count the number of leading entries wanted, at most {@link #getVoteCount()}
     * @return the first {@code count} entries in position order
     * @throws InvalidPositionException if {@code count} exceeds the vote count
     */
    @NonNull
    List<VoteEntry> entries(long count);

    /**
     * @return all entries in position order
     */
    @NonNull
    default List<VoteEntry> entries() {
        return entries(getVoteCount());
    }
}
