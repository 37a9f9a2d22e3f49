// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The number of votes recovered for one candidate.
 */
public record CandidateTally(@NonNull String candidateId, long votes) {
    public CandidateTally {
        requireNonNull(candidateId, "candidateId must not be null");
    }
}
