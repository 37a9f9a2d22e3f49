// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a trustee makes a second submission to the same ceremony. The first submission wins.
 */
public class DuplicateTrusteeSubmissionException extends VoteLedgerException {

    public DuplicateTrusteeSubmissionException(@NonNull final String trusteeId) {
        super(LedgerStatus.DUPLICATE_TRUSTEE_SUBMISSION, "Trustee " + trusteeId + " already submitted");
    }
}
