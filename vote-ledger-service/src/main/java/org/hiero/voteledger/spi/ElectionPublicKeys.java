// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Supplies the credential-signing public key of an election.
 */
@FunctionalInterface
public interface ElectionPublicKeys {
    /**
     * @param electionId the election
     * @return the key, or {@code null} if the election's keys are not available
     */
    @Nullable
    String publicKeyOf(@NonNull String electionId);
}
