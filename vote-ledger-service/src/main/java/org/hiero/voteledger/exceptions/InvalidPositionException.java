// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a ledger position outside {@code [0, voteCount)} is requested.
 */
public class InvalidPositionException extends VoteLedgerException {

    public InvalidPositionException(@NonNull final String message) {
        super(LedgerStatus.INVALID_POSITION, message);
    }
}
