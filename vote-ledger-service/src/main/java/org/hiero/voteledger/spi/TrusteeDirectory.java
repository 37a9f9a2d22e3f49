// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Looks up the public commitments trustees published during key generation.
 */
@FunctionalInterface
public interface TrusteeDirectory {
    /**
     * @param electionId the election
     * @param trusteeId  the trustee
     * @return the trustee's key-share commitment, or {@code null} if the trustee is not part of the election
     */
    @Nullable
    String commitmentOf(@NonNull String electionId, @NonNull String trusteeId);
}
