// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

/**
 * The supported hash families, for selecting a {@link HashFunction} by name.
 */
public enum HashFamily {
    /** SHA-2 family, 256 bit. */
    SHA256(Sha256HashFunction.INSTANCE),
    /** Keccak/SHA-3 family, 256 bit. */
    SHA3(Sha3HashFunction.INSTANCE);

    private final HashFunction<?> hashFunction;

    HashFamily(final HashFunction<?> hashFunction) {
        this.hashFunction = hashFunction;
    }

    /**
     * @return the hash function of this family
     */
    public HashFunction<?> hashFunction() {
        return hashFunction;
    }
}
