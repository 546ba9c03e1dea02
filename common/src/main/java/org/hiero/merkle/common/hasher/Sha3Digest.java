// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A 32 byte SHA3-256 digest. SHA3-256 is the FIPS 202 standardised form of the Keccak sponge.
 */
public final class Sha3Digest extends Digest {
    /** The all-zero SHA3-256 digest. */
    public static final Sha3Digest ZERO = new Sha3Digest(new byte[HashingUtilities.HASH_SIZE]);

    private Sha3Digest(@NonNull final byte[] hash) {
        super(hash, HashingUtilities.HASH_SIZE);
    }

    /**
     * Wrap a copy of the given bytes as a SHA3-256 digest.
     *
     * @param hash exactly 32 bytes
     * @return the digest
     * @throws IllegalArgumentException if the array is not 32 bytes long
     */
    public static Sha3Digest wrap(@NonNull final byte[] hash) {
        return new Sha3Digest(hash);
    }
}
