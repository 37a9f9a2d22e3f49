// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.hiero.voteledger.model.PartialDecryption;

/**
 * The threshold-cryptography operations required by the decryption ceremony. Implementations may be slow but are
 * called synchronously; timeouts and retries belong to the calling layer.
 */
public interface ThresholdDecryptionLibrary {
    /**
     * Checks the correctness proof of a single partial decryption.
     *
     * @param partial           the partial
     * @param trusteeCommitment the trustee's public key-share commitment
     * @return whether the partial was provably computed with the committed key share
     */
    boolean verifyPartialProof(@NonNull PartialDecryption partial, @NonNull String trusteeCommitment);

    /**
     * Recovers the plaintext of one entry from a quorum of partials.
     *
     * @param entryId  the entry being decrypted
     * @param partials exactly threshold-many validated partials for the entry, from distinct trustees
     * @return the recovered plaintext
     * @throws RuntimeException if the partials cannot be combined
     */
    @NonNull
    String combinePartials(@NonNull String entryId, @NonNull List<PartialDecryption> partials);
}
