// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.annotation.JsonIgnore;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;

/**
 * Proof that a leaf is included in the ledger whose root is {@code root}. Siblings are ordered from the leaf up to
 * the root. A proof is only meaningful relative to the root it names; older roots stay checkable through the
 * ledger's root history.
 *
 * @param position the leaf position the proof was issued for; informational, not covered by the path
 * @param leaf     the leaf hash
 * @param siblings the position-tagged sibling hashes, nearest the leaf first
 * @param root     the root the proof was issued against
 */
public record InclusionProof(
        long position, @NonNull Hash leaf, @NonNull List<SiblingHash> siblings, @NonNull Hash root) {
    public InclusionProof {
        requireNonNull(leaf, "leaf must not be null");
        requireNonNull(root, "root must not be null");
        siblings = List.copyOf(requireNonNull(siblings, "siblings must not be null"));
    }

    /**
     * @return the sibling positions, in the same order as {@link #siblings()}
     */
    @JsonIgnore
    @NonNull
    public List<SiblingPosition> positions() {
        return siblings.stream().map(SiblingHash::position).toList();
    }
}
