// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * All vote ledger configuration, bound from properties with the prefixes {@code storage.}, {@code ledger.},
 * {@code nullifiers.} and {@code ceremony.}.
 */
public record VoteLedgerConfig(
        @NonNull StorageConfig storage,
        @NonNull LedgerConfig ledger,
        @NonNull NullifierConfig nullifiers,
        @NonNull CeremonyConfig ceremony) {
    public VoteLedgerConfig {
        requireNonNull(storage, "storage must not be null");
        requireNonNull(ledger, "ledger must not be null");
        requireNonNull(nullifiers, "nullifiers must not be null");
        requireNonNull(ceremony, "ceremony must not be null");
    }
}
