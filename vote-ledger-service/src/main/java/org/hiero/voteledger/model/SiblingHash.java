// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * One step of an inclusion proof path.
 *
 * @param position the side of the path the sibling is on
 * @param hash     the hash of the sibling
 */
public record SiblingHash(@NonNull SiblingPosition position, @NonNull Hash hash) {
    public SiblingHash {
        requireNonNull(position, "position must not be null");
        requireNonNull(hash, "hash must not be null");
    }

    public static SiblingHash left(@NonNull final Hash hash) {
        return new SiblingHash(SiblingPosition.LEFT, hash);
    }

    public static SiblingHash right(@NonNull final Hash hash) {
        return new SiblingHash(SiblingPosition.RIGHT, hash);
    }
}
