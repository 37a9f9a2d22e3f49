// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Base class of every error raised by the vote ledger. Each subclass corresponds to exactly one
 * {@link LedgerStatus}; messages never contain ledger internals or decrypted data.
 */
public abstract class VoteLedgerException extends RuntimeException {
    private final LedgerStatus status;

    protected VoteLedgerException(@NonNull final LedgerStatus status, @NonNull final String message) {
        super(message);
        this.status = requireNonNull(status);
    }

    protected VoteLedgerException(
            @NonNull final LedgerStatus status, @NonNull final String message, @NonNull final Throwable cause) {
        super(message, cause);
        this.status = requireNonNull(status);
    }

    @NonNull
    public LedgerStatus getStatus() {
        return status;
    }
}
