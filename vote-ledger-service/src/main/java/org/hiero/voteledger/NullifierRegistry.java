// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.voteledger.exceptions.DuplicateNullifierException;
import org.hiero.voteledger.model.NullifierRecord;
import org.hiero.voteledger.model.Scope;

/**
 * Durable registry of one-time voting tokens.
 */
public interface NullifierRegistry {

    /**
     * Reserves a nullifier in a single indivisible step: of any number of concurrent callers reserving the same
     * {@code (scope, nullifier)}, exactly one succeeds. The reservation is durable when this method returns.
     *
     * @param scope     the scope
     * @param nullifier the nullifier
     * @return the reservation
     * @throws DuplicateNullifierException if the nullifier is already reserved in the scope
     */
    @NonNull
    NullifierRecord reserve(@NonNull Scope scope, @NonNull String nullifier);

    /**
     * Read-only status check. Never use the answer to decide whether to reserve; call {@link #reserve} and handle
     * its failure instead.
     *
     * @param scope     the scope
     * @param nullifier the nullifier
     * @return whether the nullifier is reserved
     */
    boolean query(@NonNull Scope scope, @NonNull String nullifier);

    /**
     * @param scope the scope
     * @return the number of nullifiers reserved in the scope
     */
    long reservedCount(@NonNull Scope scope);
}
