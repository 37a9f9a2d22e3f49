// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A vote entry together with its position in a ledger.
 */
public record LedgerEntry(long position, @NonNull VoteEntry entry) {
    public LedgerEntry {
        requireNonNull(entry, "entry must not be null");
    }
}
