// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The outcome of a successful append.
 *
 * @param position the position of the new entry
 * @param proof    the new entry's inclusion proof against the post-append root
 */
public record AppendResult(long position, @NonNull InclusionProof proof) {
    public AppendResult {
        requireNonNull(proof, "proof must not be null");
    }
}
