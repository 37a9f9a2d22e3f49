// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when an entry, submission or argument is malformed. Raised before any state is mutated.
 */
public class ValidationException extends VoteLedgerException {

    public ValidationException(@NonNull final String message) {
        super(LedgerStatus.INVALID_ENTRY, message);
    }
}
