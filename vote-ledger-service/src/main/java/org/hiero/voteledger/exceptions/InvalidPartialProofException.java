// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Signals that a single partial decryption failed validation. Always recovered locally: the partial is dropped
 * and the rest of its submission proceeds.
 */
public class InvalidPartialProofException extends VoteLedgerException {
    private final String trusteeId;
    private final String entryId;

    public InvalidPartialProofException(
            @NonNull final String trusteeId, @NonNull final String entryId, @NonNull final String reason) {
        super(LedgerStatus.INVALID_PARTIAL_PROOF, reason);
        this.trusteeId = trusteeId;
        this.entryId = entryId;
    }

    public String getTrusteeId() {
        return trusteeId;
    }

    public String getEntryId() {
        return entryId;
    }
}
