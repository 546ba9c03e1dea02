// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Provides common utility methods for hashing and for the canonical text form of digests.
 */
public final class HashingUtilities {

    /**
     * The size of the digests produced by both supported hash families, in bytes.
     */
    public static final int HASH_SIZE = 32;
    /**
     * The prefix of every canonical digest encoding.
     */
    public static final String ENCODING_PREFIX = "0x";
    /**
     * The standard name of the SHA2 256-bit hash algorithm.
     * <p>
     * This value must match what is declared for the
     * <a href="https://docs.oracle.com/en/java/javase/17/docs/specs/security/standard-names.html#messagedigest-algorithms">
     * standard message digest names</a>.
     */
    public static final String SHA_256_ALGORITHM = "SHA-256";
    /**
     * The standard name of the SHA3 256-bit (Keccak based) hash algorithm.
     */
    public static final String SHA3_256_ALGORITHM = "SHA3-256";

    private static final HexFormat HEX = HexFormat.of();

    private HashingUtilities() {
        throw new UnsupportedOperationException("Utility Class");
    }

    /**
     * Returns a new {@link MessageDigest} instance for the given algorithm, throwing an unchecked exception if the
     * algorithm is not found. A missing standard algorithm means a broken runtime and is not recoverable.
     *
     * @param algorithm the standard name of the algorithm
     * @return a {@link MessageDigest} instance for the algorithm
     */
    public static MessageDigest digestOrThrow(@NonNull final String algorithm) {
        try {
            return MessageDigest.getInstance(Objects.requireNonNull(algorithm));
        } catch (final NoSuchAlgorithmException fatal) {
            throw new IllegalStateException(fatal);
        }
    }

    /**
     * Returns the canonical encoding of the given digest bytes: {@value #ENCODING_PREFIX} followed by two lowercase
     * hex characters per byte.
     *
     * @param hash the digest bytes
     * @return the canonical encoding
     */
    public static String encode(@NonNull final byte[] hash) {
        return ENCODING_PREFIX + HEX.formatHex(hash);
    }

    /**
     * Parses a canonical encoding back into digest bytes. The {@value #ENCODING_PREFIX} prefix is optional and hex
     * digits may be of either case.
     *
     * @param encoded the encoded digest
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is not valid hex
     */
    public static byte[] decode(@NonNull final String encoded) {
        final String trimmed = encoded.strip();
        final String hex = trimmed.startsWith(ENCODING_PREFIX) ? trimmed.substring(ENCODING_PREFIX.length()) : trimmed;
        return HEX.parseHex(hex);
    }
}
