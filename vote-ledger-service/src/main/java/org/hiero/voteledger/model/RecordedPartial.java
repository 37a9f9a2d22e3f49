// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Instant;

/**
 * A partial decryption as retained for audit, with the outcome of its validation.
 *
 * @param partial     the submitted partial
 * @param valid       whether the partial passed validation and counts toward the tally
 * @param dropReason  why an invalid partial was dropped, {@code null} when valid
 * @param receivedAt  when the partial was received
 */
public record RecordedPartial(
        @NonNull PartialDecryption partial,
        boolean valid,
        @Nullable String dropReason,
        @NonNull Instant receivedAt) {
    public RecordedPartial {
        requireNonNull(partial, "partial must not be null");
        requireNonNull(receivedAt, "receivedAt must not be null");
    }

    public static RecordedPartial accepted(@NonNull final PartialDecryption partial, @NonNull final Instant now) {
        return new RecordedPartial(partial, true, null, now);
    }

    public static RecordedPartial dropped(
            @NonNull final PartialDecryption partial, @NonNull final String reason, @NonNull final Instant now) {
        return new RecordedPartial(partial, false, requireNonNull(reason), now);
    }
}
