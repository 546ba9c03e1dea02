// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.function.Function;

/**
 * Base for hash functions backed by a JCA {@link java.security.MessageDigest}. A new message digest is obtained for
 * each call, which keeps instances free of mutable state.
 *
 * @param <D> the digest type
 */
abstract class MessageDigestHashFunction<D extends Digest> implements HashFunction<D> {
    private final String algorithm;
    private final Function<byte[], D> wrapper;
    private final D zero;

    MessageDigestHashFunction(
            @NonNull final String algorithm, @NonNull final Function<byte[], D> wrapper, @NonNull final D zero) {
        this.algorithm = Objects.requireNonNull(algorithm);
        this.wrapper = Objects.requireNonNull(wrapper);
        this.zero = Objects.requireNonNull(zero);
    }

    @Override
    public D hash(@NonNull final byte[] data) {
        Objects.requireNonNull(data);
        return wrapper.apply(HashingUtilities.digestOrThrow(algorithm).digest(data));
    }

    @Override
    public D zero() {
        return zero;
    }

    @Override
    public D wrap(@NonNull final byte[] hash) {
        return wrapper.apply(hash);
    }

    @Override
    public int digestLength() {
        return zero.length();
    }

    @Override
    public String algorithm() {
        return algorithm;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + algorithm + "]";
    }
}
