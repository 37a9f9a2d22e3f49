// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * One trustee's contribution toward decrypting one ledger entry.
 *
 * @param trusteeId         the contributing trustee
 * @param entryId           the {@link VoteEntry#id()} the partial decrypts
 * @param value             the partial decryption, opaque to the ledger
 * @param correctnessProof  proof the partial was computed with the trustee's key share
 */
public record PartialDecryption(
        @NonNull String trusteeId, @NonNull String entryId, @NonNull String value, @NonNull String correctnessProof) {
    public PartialDecryption {
        requireNonNull(trusteeId, "trusteeId must not be null");
        requireNonNull(entryId, "entryId must not be null");
        requireNonNull(value, "value must not be null");
        requireNonNull(correctnessProof, "correctnessProof must not be null");
    }
}
