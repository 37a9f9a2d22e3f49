// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

/**
 * Status codes carried by every {@link VoteLedgerException}. The calling layer maps these to its own responses.
 */
public enum LedgerStatus {
    INVALID_ENTRY,
    CREDENTIAL_ALREADY_USED,
    INVALID_POSITION,
    LEDGER_EMPTY,
    CEREMONY_NOT_FOUND,
    CEREMONY_ALREADY_COMPLETED,
    DUPLICATE_TRUSTEE_SUBMISSION,
    INVALID_PARTIAL_PROOF,
    TALLY_FAILED,
    INVALID_CEREMONY_STATE,
    STORAGE_FAILURE
}
