// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a durable store cannot be read or written.
 */
public class LedgerStorageException extends VoteLedgerException {

    public LedgerStorageException(@NonNull final String message, @NonNull final Throwable cause) {
        super(LedgerStatus.STORAGE_FAILURE, message, cause);
    }
}
