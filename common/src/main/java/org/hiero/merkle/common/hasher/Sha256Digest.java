// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A 32 byte SHA-256 digest.
 */
public final class Sha256Digest extends Digest {
    /** The all-zero SHA-256 digest. */
    public static final Sha256Digest ZERO = new Sha256Digest(new byte[HashingUtilities.HASH_SIZE]);

    private Sha256Digest(@NonNull final byte[] hash) {
        super(hash, HashingUtilities.HASH_SIZE);
    }

    /**
     * Wrap a copy of the given bytes as a SHA-256 digest.
     *
     * @param hash exactly 32 bytes
     * @return the digest
     * @throws IllegalArgumentException if the array is not 32 bytes long
     */
    public static Sha256Digest wrap(@NonNull final byte[] hash) {
        return new Sha256Digest(hash);
    }
}
