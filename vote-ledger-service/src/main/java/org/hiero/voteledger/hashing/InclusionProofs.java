// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.hashing;

import static org.hiero.voteledger.hashing.LedgerHashing.joinHashes;
import static org.hiero.voteledger.hashing.LedgerHashing.newMessageDigest;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.security.MessageDigest;
import org.hiero.voteledger.model.Hash;
import org.hiero.voteledger.model.InclusionProof;
import org.hiero.voteledger.model.SiblingHash;
import org.hiero.voteledger.model.VoteEntry;

/**
 * Stateless verification of {@link InclusionProof}s. Needs no access to the ledger that issued the proof.
 *
 * <p><b>Example usage:</b>
 * <pre>{@code
 * InclusionProof proof = receipt.proof();
 * boolean recorded = InclusionProofs.verify(proof) && InclusionProofs.verifyEntry(proof, myEntry);
 * }</pre>
 */
public final class InclusionProofs {

    private InclusionProofs() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Recombines the proof's leaf with its siblings, strictly following each sibling's position, and compares the
     * result with the proof's root. Hashes are never reordered by value.
     *
     * <p>{@link InclusionProof#position()} is not checked. The path proves that the leaf is under the root; the
     * leaf's index cannot be recovered from the sibling sides alone, because they do not carry the sizes of the
     * subtrees to the leaf's left. Holders that need the index confirmed compare it with
     * {@code VoteLedger.getEntry(position)}.</p>
     *
     * @param proof the proof, may be {@code null} or malformed
     * @return whether the proof is well formed and its path recomputes {@code proof.root()}
     */
    public static boolean verify(@Nullable final InclusionProof proof) {
        if (proof == null) {
            return false;
        }
        return computeRoot(newMessageDigest(), proof).equals(proof.root());
    }

    /**
     * Verifies the proof and additionally checks that it proves the given entry.
     *
     * @param proof the proof
     * @param entry the entry the holder believes was recorded
     * @return whether the proof is valid and its leaf is the entry's leaf hash
     */
    public static boolean verifyEntry(@Nullable final InclusionProof proof, @NonNull final VoteEntry entry) {
        if (proof == null) {
            return false;
        }
        final MessageDigest digest = newMessageDigest();
        return LedgerHashing.leafHash(digest, entry).equals(proof.leaf()) && verify(proof);
    }

    /**
     * Computes the root implied by the proof's leaf and siblings.
     *
     * @param digest the digest to use
     * @param proof  the proof
     * @return the implied root
     */
    @NonNull
    public static Hash computeRoot(@NonNull final MessageDigest digest, @NonNull final InclusionProof proof) {
        Hash current = proof.leaf();
        for (final SiblingHash sibling : proof.siblings()) {
            current = switch (sibling.position()) {
                case LEFT -> joinHashes(digest, sibling.hash(), current);
                case RIGHT -> joinHashes(digest, current, sibling.hash());
            };
        }
        return current;
    }
}
