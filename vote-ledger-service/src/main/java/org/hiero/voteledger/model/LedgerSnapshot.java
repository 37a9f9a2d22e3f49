// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Instant;

/**
 * The compact commitment to a ledger published for external anchoring.
 *
 * @param scope     the ledger's scope
 * @param root      the root after {@code voteCount} entries
 * @param voteCount the number of entries committed to
 * @param timestamp when the snapshot was taken
 */
public record LedgerSnapshot(
        @NonNull Scope scope, @NonNull Hash root, long voteCount, @NonNull Instant timestamp) {
    public LedgerSnapshot {
        requireNonNull(scope, "scope must not be null");
        requireNonNull(root, "root must not be null");
        requireNonNull(timestamp, "timestamp must not be null");
        if (voteCount < 0) {
            throw new IllegalArgumentException("voteCount must be non-negative");
        }
    }
}
