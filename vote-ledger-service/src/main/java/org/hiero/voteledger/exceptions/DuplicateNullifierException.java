// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.exceptions;

/**
 * Thrown when a nullifier has already been reserved in its scope, i.e. the credential was already used to vote.
 * The message deliberately says nothing about the existing entry.
 */
public class DuplicateNullifierException extends VoteLedgerException {
    public static final String MESSAGE = "Credential already used to vote";

    public DuplicateNullifierException() {
        super(LedgerStatus.CREDENTIAL_ALREADY_USED, MESSAGE);
    }
}
