// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A side-effect-free summary of a ceremony.
 *
 * @param received the number of distinct trustees with at least one validated partial
 * @param required the threshold of distinct trustees
 * @param status   the current phase
 */
public record CeremonyProgress(int received, int required, @NonNull CeremonyStatus status) {
    public CeremonyProgress {
        requireNonNull(status, "status must not be null");
    }
}
