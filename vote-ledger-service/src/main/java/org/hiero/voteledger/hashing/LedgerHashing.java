// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.hashing;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.hiero.voteledger.model.Hash;
import org.hiero.voteledger.model.VoteEntry;

/**
 * Hashing helpers shared by the ledger and by proof verification.
 *
 * <p>Domain separation prefixes keep leaf and internal hashes apart:
 * <ul>
 *   <li>Leaf nodes: prefixed with 0x00</li>
 *   <li>Internal nodes: prefixed with 0x02</li>
 * </ul>
 * Leaf fields are each preceded by their 4-byte big-endian length so that no two distinct entries hash the same
 * input.
 */
public final class LedgerHashing {

    private static final String HASH_ALGORITHM = "SHA-384";
    private static final byte LEAF_PREFIX = 0x00;
    private static final byte INTERNAL_NODE_PREFIX = 0x02;

    private LedgerHashing() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return a fresh SHA-384 digest
     */
    @NonNull
    public static MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " algorithm not found", e);
        }
    }

    /**
     * Computes {@code H(id ‖ encryptedVote ‖ commitment ‖ nullifier)} with the leaf prefix.
     *
     * @param digest the digest to use, reset before use
     * @param entry  the entry
     * @return the leaf hash
     */
    @NonNull
    public static Hash leafHash(@NonNull final MessageDigest digest, @NonNull final VoteEntry entry) {
        requireNonNull(digest, "digest must not be null");
        requireNonNull(entry, "entry must not be null");
        digest.reset();
        digest.update(LEAF_PREFIX);
        updateField(digest, entry.id());
        updateField(digest, entry.encryptedVote());
        updateField(digest, entry.commitment());
        updateField(digest, entry.nullifier());
        return new Hash(digest.digest());
    }

    /**
     * Hashes two children into their parent. The argument order is significant.
     *
     * @param digest the digest to use, reset before use
     * @param left   the left child
     * @param right  the right child
     * @return the parent hash
     */
    @NonNull
    public static Hash joinHashes(
            @NonNull final MessageDigest digest, @NonNull final Hash left, @NonNull final Hash right) {
        requireNonNull(digest, "digest must not be null");
        requireNonNull(left, "left must not be null");
        requireNonNull(right, "right must not be null");
        digest.reset();
        digest.update(INTERNAL_NODE_PREFIX);
        left.writeTo(digest);
        right.writeTo(digest);
        return new Hash(digest.digest());
    }

    private static void updateField(@NonNull final MessageDigest digest, @NonNull final String field) {
        final byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        digest.update((byte) (bytes.length >>> 24));
        digest.update((byte) (bytes.length >>> 16));
        digest.update((byte) (bytes.length >>> 8));
        digest.update((byte) bytes.length);
        digest.update(bytes);
    }
}
