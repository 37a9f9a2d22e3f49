// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when the tally cannot be produced for the whole bound entry set. The message is generic so that no
 * partial result leaks; the cause, if any, is only meant for operator logs.
 */
public class TallyFailureException extends VoteLedgerException {
    public static final String MESSAGE = "Tally could not be completed";

    public TallyFailureException() {
        super(LedgerStatus.TALLY_FAILED, MESSAGE);
    }

    public TallyFailureException(@NonNull final Throwable cause) {
        super(LedgerStatus.TALLY_FAILED, MESSAGE, cause);
    }
}
