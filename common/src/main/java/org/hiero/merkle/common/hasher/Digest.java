// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import org.hiero.merkle.common.utils.Preconditions;

/**
 * An immutable, fixed size hash value. The all-zero value of a digest type is its default: it marks an empty
 * accumulator slot and is the root of an empty leaf list.
 * <p>
 * Two digests are equal only if they are of the same concrete type and hold the same bytes, so digests of
 * different hash families never compare equal.
 */
public abstract class Digest {
    private final byte[] hash;

    /**
     * Create a digest over a copy of the given bytes.
     *
     * @param hash the digest bytes
     * @param expectedLength the fixed length of this digest type
     * @throws IllegalArgumentException if the byte count is not the expected length
     */
    protected Digest(@NonNull final byte[] hash, final int expectedLength) {
        this.hash = Preconditions.requireExactLength(hash, expectedLength).clone();
    }

    /**
     * @return a copy of the digest bytes
     */
    public byte[] toByteArray() {
        return hash.clone();
    }

    /**
     * @return the number of bytes in this digest
     */
    public int length() {
        return hash.length;
    }

    /**
     * @return true if every byte of this digest is zero
     */
    public boolean isZero() {
        for (final byte b : hash) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(hash, ((Digest) o).hash);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(hash);
    }

    /**
     * @return the canonical encoding, "0x" followed by lowercase hex
     */
    @Override
    public String toString() {
        return HashingUtilities.encode(hash);
    }
}
