// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.annotation.JsonCreator;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Instant;

/**
 * A reserved nullifier. Unique on {@code (scope, nullifier)}.
 *
 * @param scope      the scope the nullifier is unique in
 * @param nullifier  the nullifier
 * @param reservedAt when the reservation was made
 * @param entryId    the ledger entry the reservation was made for, {@code null} for a reservation made directly
 *                   through the registry
 */
public record NullifierRecord(
        @NonNull Scope scope, @NonNull String nullifier, @NonNull Instant reservedAt, @Nullable String entryId) {
    @JsonCreator
    public NullifierRecord {
        requireNonNull(scope, "scope must not be null");
        requireNonNull(nullifier, "nullifier must not be null");
        requireNonNull(reservedAt, "reservedAt must not be null");
    }

    public NullifierRecord(@NonNull final Scope scope, @NonNull final String nullifier, @NonNull final Instant at) {
        this(scope, nullifier, at, null);
    }
}
