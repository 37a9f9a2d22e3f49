// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Set;
import org.hiero.voteledger.exceptions.LedgerStorageException;
import org.hiero.voteledger.model.Scope;
import org.hiero.voteledger.model.VoteEntry;

/**
 * Durable, append-only storage of ledger entries, one sequence per scope.
 */
public interface VoteEntryStore {

    /**
     * @param scope the scope
     * @return the scope's entries in position order
     * @throws LedgerStorageException if the entries cannot be read
     */
    @NonNull
    List<VoteEntry> load(@NonNull Scope scope);

    /**
     * Durably appends an entry; it is readable by {@link #load(Scope)} once this returns.
     *
     * @param scope the scope
     * @param entry the entry
     * @throws LedgerStorageException if the entry cannot be written
     */
    void append(@NonNull Scope scope, @NonNull VoteEntry entry);

    /**
     * @return every scope with at least one stored entry
     * @throws LedgerStorageException if the store cannot be listed
     */
    @NonNull
    Set<Scope> scopes();
}
