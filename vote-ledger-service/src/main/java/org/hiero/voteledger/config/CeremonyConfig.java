// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;

/**
 * Configuration of decryption ceremonies.
 *
 * @param timeout           how long a ceremony may stay unfinished before it is aborted
 * @param minRequiredShares the smallest threshold a ceremony may be started with
 */
public record CeremonyConfig(@NonNull Duration timeout, int minRequiredShares) {
    public CeremonyConfig {
        requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("ceremony timeout must be positive");
        }
        if (minRequiredShares < 1) {
            throw new IllegalArgumentException("minRequiredShares must be at least 1");
        }
    }
}
