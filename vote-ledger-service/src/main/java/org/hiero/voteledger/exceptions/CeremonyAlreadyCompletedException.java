// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a ceremony that has reached a terminal phase is asked to make progress.
 */
public class CeremonyAlreadyCompletedException extends VoteLedgerException {

    public CeremonyAlreadyCompletedException(@NonNull final String message) {
        super(LedgerStatus.CEREMONY_ALREADY_COMPLETED, message);
    }
}
