// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

/**
 * The SHA3-256 hash function, from the Keccak family.
 */
public final class Sha3HashFunction extends MessageDigestHashFunction<Sha3Digest> {
    /** The shared instance. */
    public static final Sha3HashFunction INSTANCE = new Sha3HashFunction();

    private Sha3HashFunction() {
        super(HashingUtilities.SHA3_256_ALGORITHM, Sha3Digest::wrap, Sha3Digest.ZERO);
    }
}
