// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.hiero.voteledger.model.LedgerSnapshot;
import org.hiero.voteledger.model.Scope;

/**
 * Durable record of published ledger snapshots.
 */
public interface SnapshotStore {

    /**
     * @param snapshot the snapshot to record
     */
    void append(@NonNull LedgerSnapshot snapshot);

    /**
     * @param scope the scope
     * @return the scope's published snapshots, oldest first
     */
    @NonNull
    List<LedgerSnapshot> load(@NonNull Scope scope);
}
