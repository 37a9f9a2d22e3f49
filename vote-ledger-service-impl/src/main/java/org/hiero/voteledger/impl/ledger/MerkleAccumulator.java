// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.ledger;

import static java.util.Objects.requireNonNull;
import static org.hiero.voteledger.hashing.LedgerHashing.joinHashes;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.hiero.voteledger.hashing.LedgerHashing;
import org.hiero.voteledger.model.Hash;
import org.hiero.voteledger.model.InclusionProof;
import org.hiero.voteledger.model.SiblingHash;

/**
 * An append-only binary Merkle accumulator over leaf hashes.
 *
 * <p>Level {@code k} holds the roots of the aligned complete subtrees of {@code 2^k} leaves. Whenever two subtrees
 * of equal size exist they are merged, so the leaf count's set bits name the "peaks" that remain. The root folds
 * the peaks from right to left, {@code root = H(p0 ‖ H(p1 ‖ … pk))}, and is the all-zero hash without leaves.</p>
 *
 * <p>Every root the accumulator ever had is retained, indexed by leaf count.</p>
 *
 * <p>Appends are not thread safe and must be serialized by the caller. Reads, including {@link #proof(long)}, may
 * run concurrently with each other between appends.</p>
 */
public class MerkleAccumulator {
    private final MessageDigest digest;
    /** {@code levels.get(k).get(j)} is the root of leaves {@code [j * 2^k, (j + 1) * 2^k)}. */
    private final List<List<Hash>> levels = new ArrayList<>();
    /** {@code rootHistory.get(n)} is the root over the first {@code n} leaves. */
    private final List<Hash> rootHistory = new ArrayList<>();

    private final Set<Hash> knownRoots = new HashSet<>();
    private long leafCount;

    public MerkleAccumulator(@NonNull final MessageDigest digest) {
        this.digest = requireNonNull(digest, "digest must not be null");
        rootHistory.add(Hash.EMPTY);
        knownRoots.add(Hash.EMPTY);
    }

    /**
     * Add a new leaf.
     *
     * @param leaf the leaf hash
     * @return the position of the leaf
     */
    public long addLeaf(@NonNull final Hash leaf) {
        requireNonNull(leaf, "leaf must not be null");
        final long i = leafCount;
        level(0).add(leaf);
        int k = 0;
        for (long n = i; (n & 1L) == 1; n >>= 1) {
            final List<Hash> current = levels.get(k);
            final Hash right = current.get(current.size() - 1);
            final Hash left = current.get(current.size() - 2);
            level(k + 1).add(joinHashes(digest, left, right));
            k++;
        }
        leafCount++;
        final Hash root = computeRootHash();
        rootHistory.add(root);
        knownRoots.add(root);
        return i;
    }

    /**
     * @return the current root, {@link Hash#EMPTY} if no leaves exist
     */
    @NonNull
    public Hash rootHash() {
        return rootHistory.get(rootHistory.size() - 1);
    }

    /**
     * @param count a leaf count not above {@link #leafCount()}
     * @return the root over the first {@code count} leaves
     * @throws IndexOutOfBoundsException if the accumulator never had {@code count} leaves
     */
    @NonNull
    public Hash rootAt(final long count) {
        if (count < 0 || count > leafCount) {
            throw new IndexOutOfBoundsException("no root for " + count + " leaves, have " + leafCount);
        }
        return rootHistory.get(Math.toIntExact(count));
    }

    /**
     * @param root a root
     * @return whether the accumulator had this root at some leaf count
     */
    public boolean isHistoricalRoot(@NonNull final Hash root) {
        return knownRoots.contains(root);
    }

    /**
     * @param position a leaf position
     * @return the leaf hash at that position
     */
    @NonNull
    public Hash leafAt(final long position) {
        checkPosition(position);
        return levels.get(0).get(Math.toIntExact(position));
    }

    /**
     * Builds the position-tagged path from a leaf to the current root. Siblings are first the nodes inside the
     * leaf's peak, then the fold of all peaks to its right (a right sibling), then each peak to its left (left
     * siblings, nearest first).
     *
     * @param position a leaf position
     * @return the proof against {@link #rootHash()}
     * @throws IndexOutOfBoundsException if {@code position} is not a leaf position
     */
    @NonNull
    public InclusionProof proof(final long position) {
        checkPosition(position);
        final List<Peak> peaks = peaks();
        int peakIndex = 0;
        while (position >= peaks.get(peakIndex).end()) {
            peakIndex++;
        }
        final Peak peak = peaks.get(peakIndex);
        final List<SiblingHash> siblings = new ArrayList<>();
        for (int level = 0; level < peak.height(); level++) {
            final long index = position >> level;
            final Hash sibling = levels.get(level).get(Math.toIntExact(index ^ 1L));
            siblings.add((index & 1L) == 0 ? SiblingHash.right(sibling) : SiblingHash.left(sibling));
        }
        if (peakIndex < peaks.size() - 1) {
            siblings.add(SiblingHash.right(foldFrom(LedgerHashing.newMessageDigest(), peaks, peakIndex + 1)));
        }
        for (int j = peakIndex - 1; j >= 0; j--) {
            siblings.add(SiblingHash.left(peaks.get(j).hash()));
        }
        return new InclusionProof(position, leafAt(position), siblings, rootHash());
    }

    /**
     * @return the number of leaves
     */
    public long leafCount() {
        return leafCount;
    }

    private Hash computeRootHash() {
        final List<Peak> peaks = peaks();
        return peaks.isEmpty() ? Hash.EMPTY : foldFrom(digest, peaks, 0);
    }

    private static Hash foldFrom(final MessageDigest digest, final List<Peak> peaks, final int from) {
        Hash acc = peaks.get(peaks.size() - 1).hash();
        for (int j = peaks.size() - 2; j >= from; j--) {
            acc = joinHashes(digest, peaks.get(j).hash(), acc);
        }
        return acc;
    }

    private List<Peak> peaks() {
        final List<Peak> peaks = new ArrayList<>();
        long start = 0;
        for (int height = 63 - Long.numberOfLeadingZeros(leafCount); height >= 0; height--) {
            final long size = 1L << height;
            if ((leafCount & size) != 0) {
                final Hash hash = levels.get(height).get(Math.toIntExact(start >> height));
                peaks.add(new Peak(height, start + size, hash));
                start += size;
            }
        }
        return peaks;
    }

    private List<Hash> level(final int k) {
        while (levels.size() <= k) {
            levels.add(new ArrayList<>());
        }
        return levels.get(k);
    }

    private void checkPosition(final long position) {
        if (position < 0 || position >= leafCount) {
            throw new IndexOutOfBoundsException("position " + position + " outside [0, " + leafCount + ")");
        }
    }

    /**
     * @param height the peak's height, covering {@code 2^height} leaves
     * @param end    one past the last leaf position the peak covers
     * @param hash   the peak's hash
     */
    private record Peak(int height, long end, Hash hash) {}
}
