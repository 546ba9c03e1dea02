// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Digest} value semantics.
 */
@DisplayName("Digest Tests")
class DigestTest {

    @Test
    @DisplayName("Digests of different families never compare equal, even over identical bytes")
    void testEqualityIsPerType() {
        final byte[] bytes = new byte[32];
        bytes[0] = 7;
        final Sha256Digest sha256 = Sha256Digest.wrap(bytes);
        final Sha3Digest sha3 = Sha3Digest.wrap(bytes);

        assertThat(sha256).isEqualTo(Sha256Digest.wrap(bytes.clone()));
        assertThat(sha256).hasSameHashCodeAs(Sha256Digest.wrap(bytes.clone()));
        assertThat((Digest) sha256).isNotEqualTo(sha3);
    }

    @Test
    @DisplayName("Neither the wrapped array nor the returned array alias the digest content")
    void testImmutable() {
        final byte[] bytes = new byte[32];
        final Sha256Digest digest = Sha256Digest.wrap(bytes);
        bytes[0] = 1;
        assertThat(digest.isZero()).isTrue();

        digest.toByteArray()[0] = 1;
        assertThat(digest).isEqualTo(Sha256Digest.ZERO);
    }

    @Test
    @DisplayName("A single non-zero byte anywhere makes the digest non-zero")
    void testIsZero() {
        final byte[] bytes = new byte[32];
        bytes[31] = 1;
        assertThat(Sha3Digest.wrap(bytes).isZero()).isFalse();
        assertThat(Sha3Digest.ZERO.isZero()).isTrue();
    }

    @Test
    @DisplayName("The wrong length is rejected")
    void testWrongLength() {
        assertThatIllegalArgumentException().isThrownBy(() -> Sha3Digest.wrap(new byte[0]));
        assertThatIllegalArgumentException().isThrownBy(() -> Sha256Digest.wrap(new byte[33]));
    }

    @Test
    @DisplayName("HashingUtilities.decode reads the canonical encoding, with or without its prefix")
    void testDecodeCanonicalEncoding() {
        final Sha256Digest digest = Sha256HashFunction.INSTANCE.hash("decode me");
        final String encoded = digest.toString();

        assertThat(HashingUtilities.decode(encoded)).isEqualTo(digest.toByteArray());
        assertThat(HashingUtilities.decode(encoded.substring(2).toUpperCase())).isEqualTo(digest.toByteArray());
        assertThatIllegalArgumentException().isThrownBy(() -> HashingUtilities.decode("0xzz"));
    }
}
