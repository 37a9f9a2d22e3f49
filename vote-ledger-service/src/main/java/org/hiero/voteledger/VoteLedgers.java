// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Optional;
import org.hiero.voteledger.model.Scope;

/**
 * The explicit store of every ledger, one per scope. Owned by the calling layer.
 */
public interface VoteLedgers {

    /**
     * Returns the ledger of a scope, opening (and restoring) it on first use.
     *
     * @param scope the scope
     * @return its ledger
     */
    @NonNull
    VoteLedger ledger(@NonNull Scope scope);

    /**
     * @param scope the scope
     * @return the ledger of the scope if it has been opened or has durable entries
     */
    @NonNull
    Optional<VoteLedger> existingLedger(@NonNull Scope scope);

    /**
     * @param electionId the election
     * @return the ledgers of every scope of the election that exists, ordered by scope key
     */
    @NonNull
    List<VoteLedger> ledgersFor(@NonNull String electionId);
}
