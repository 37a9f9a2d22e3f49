// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when no decryption ceremony exists for an election.
 */
public class CeremonyNotFoundException extends VoteLedgerException {

    public CeremonyNotFoundException(@NonNull final String electionId) {
        super(LedgerStatus.CEREMONY_NOT_FOUND, "No decryption ceremony for election " + electionId);
    }
}
