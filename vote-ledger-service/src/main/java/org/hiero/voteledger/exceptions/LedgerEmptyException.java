// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a proof is requested from a ledger that has no entries.
 */
public class LedgerEmptyException extends VoteLedgerException {

    public LedgerEmptyException(@NonNull final String message) {
        super(LedgerStatus.LEDGER_EMPTY, message);
    }
}
