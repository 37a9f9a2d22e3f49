// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown on an illegal ceremony transition, such as starting a ceremony that is already running.
 */
public class CeremonyStateException extends VoteLedgerException {

    public CeremonyStateException(@NonNull final String message) {
        super(LedgerStatus.INVALID_CEREMONY_STATE, message);
    }
}
