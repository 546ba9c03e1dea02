// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.charset.StandardCharsets;

/**
 * A hash function producing digests of type {@code D}, together with the canonical encoding of those digests.
 * <p>
 * The canonical encoding is more than a display form: two child digests are combined into their parent by hashing
 * the UTF-8 bytes of {@code encode(left) + encode(right)}, never the raw concatenated digest bytes. A tree built by
 * concatenating raw bytes has different, incompatible roots.
 * <p>
 * Implementations must be deterministic and stateless, so one instance can be shared across threads.
 *
 * @param <D> the digest type
 */
public interface HashFunction<D extends Digest> {

    /**
     * Hash the given bytes.
     *
     * @param data the data to hash
     * @return the digest of the data
     */
    D hash(@NonNull byte[] data);

    /**
     * Hash the UTF-8 bytes of the given string.
     *
     * @param data the string to hash
     * @return the digest of the string
     */
    default D hash(@NonNull final String data) {
        return hash(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the canonical encoding of the given digest, "0x" followed by two lowercase hex characters per byte.
     *
     * @param digest the digest to encode
     * @return the canonical encoding
     */
    default String encode(@NonNull final D digest) {
        return digest.toString();
    }

    /**
     * Combine a left and a right child into their parent digest.
     *
     * @param left the left child
     * @param right the right child
     * @return {@code hash(utf8(encode(left) + encode(right)))}
     */
    default D combine(@NonNull final D left, @NonNull final D right) {
        return hash((encode(left) + encode(right)).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return the all-zero digest, used as the empty value
     */
    D zero();

    /**
     * Wrap existing digest bytes, for example a digest restored from storage.
     *
     * @param hash the digest bytes
     * @return the digest
     * @throws IllegalArgumentException if the byte count is not {@link #digestLength()}
     */
    D wrap(@NonNull byte[] hash);

    /**
     * @return the size of produced digests, in bytes
     */
    int digestLength();

    /**
     * @return the standard JCA name of the underlying algorithm
     */
    String algorithm();
}
