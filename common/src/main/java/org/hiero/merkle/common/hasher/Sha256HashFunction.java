// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

/**
 * The SHA-256 hash function.
 */
public final class Sha256HashFunction extends MessageDigestHashFunction<Sha256Digest> {
    /** The shared instance. */
    public static final Sha256HashFunction INSTANCE = new Sha256HashFunction();

    private Sha256HashFunction() {
        super(HashingUtilities.SHA_256_ALGORITHM, Sha256Digest::wrap, Sha256Digest.ZERO);
    }
}
