// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * What a voter keeps after a successful submission to later check that the vote was recorded unmodified.
 *
 * @param confirmationCode short random code identifying the receipt
 * @param scope            the ledger the vote was recorded in
 * @param entryId          the id of the recorded entry
 * @param position         the entry's position in the ledger
 * @param proof            the inclusion proof against the root at submission time
 */
public record VoteReceipt(
        @NonNull String confirmationCode,
        @NonNull Scope scope,
        @NonNull String entryId,
        long position,
        @NonNull InclusionProof proof) {
    public VoteReceipt {
        requireNonNull(confirmationCode, "confirmationCode must not be null");
        requireNonNull(scope, "scope must not be null");
        requireNonNull(entryId, "entryId must not be null");
        requireNonNull(proof, "proof must not be null");
    }
}
