// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.model;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * An immutable SHA-384 digest. Used for leaf hashes, internal node hashes and ledger roots.
 */
public final class Hash implements Comparable<Hash> {
    /** Length in bytes of every hash produced by the ledger. */
    public static final int LENGTH = 48;

    /** The root of a ledger without entries. */
    public static final Hash EMPTY = new Hash(new byte[LENGTH]);

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] value;

    /**
     * Create a hash from the given digest bytes. The bytes are copied.
     *
     * @param value the digest
     * @throws IllegalArgumentException if the digest is not {@link #LENGTH} bytes long
     */
    public Hash(@NonNull final byte[] value) {
        requireNonNull(value, "value must not be null");
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("hash must be " + LENGTH + " bytes, got " + value.length);
        }
        this.value = value.clone();
    }

    /**
     * Parse a hash from its hex representation.
     *
     * @param hex lower or upper case hex
     * @return the hash
     * @throws IllegalArgumentException if the text is not valid hex of the right length
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    @NonNull
    public static Hash fromHex(@NonNull final String hex) {
        requireNonNull(hex, "hex must not be null");
        return new Hash(HEX.parseHex(hex));
    }

    /**
     * @return a copy of the digest bytes
     */
    @NonNull
    public byte[] copyToByteArray() {
        return value.clone();
    }

    /**
     * Feed this hash into a digest without copying it.
     *
     * @param digest the digest to update
     */
    public void writeTo(@NonNull final MessageDigest digest) {
        digest.update(value);
    }

    /**
     * @return the lower case hex representation
     */
    @JsonValue
    @NonNull
    public String toHex() {
        return HEX.formatHex(value);
    }

    @Override
    public int compareTo(@NonNull final Hash other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hash that)) {
            return false;
        }
        return MessageDigest.isEqual(value, that.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return toHex().substring(0, 12);
    }
}
