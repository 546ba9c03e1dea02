// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.hasher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests for {@link HashFunction} and its SHA-256 and SHA3-256 implementations.
 */
@DisplayName("HashFunction Tests")
class HashFunctionTest {

    /**
     * Known digests of the single character "a" for each family.
     */
    static Stream<Arguments> knownDigestsOfA() {
        return Stream.of(
                Arguments.of(
                        Sha256HashFunction.INSTANCE,
                        "0xca978112ca1bbdcafac231b39a23dc4da786eff8147c4e72b9807785afee48bb"),
                Arguments.of(
                        Sha3HashFunction.INSTANCE,
                        "0x80084bf2fba02475726feb2cab2d8215eab14bc6bdd8bfb2c8151257032ecd8b"));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("knownDigestsOfA")
    @DisplayName("Hashing \"a\" should produce the standard test vector")
    void testKnownDigest(final HashFunction<?> hashFunction, final String expected) {
        assertThat(hashFunction.hash("a").toString()).isEqualTo(expected);
        assertThat(hashFunction.hash("a".getBytes(StandardCharsets.UTF_8)).toString())
                .isEqualTo(expected);
    }

    @ParameterizedTest
    @EnumSource(HashFamily.class)
    @DisplayName("Encoding is 0x followed by 64 lowercase hex characters")
    void testEncodingFormat(final HashFamily family) {
        assertThat(encodeHash(family.hashFunction(), "some leaf")).matches("0x[0-9a-f]{64}");
    }

    @ParameterizedTest
    @EnumSource(HashFamily.class)
    @DisplayName("Zero digest is 32 zero bytes")
    void testZero(final HashFamily family) {
        final Digest zero = family.hashFunction().zero();
        assertThat(zero.isZero()).isTrue();
        assertThat(zero.toByteArray()).hasSize(32).containsOnly(0);
        assertThat(zero.toString()).isEqualTo("0x" + "0".repeat(64));
        assertThat(family.hashFunction().digestLength()).isEqualTo(32);
    }

    @Test
    @DisplayName("Combine hashes the concatenated text encodings, not the raw bytes")
    void testCombineUsesTextEncoding() {
        final Sha256HashFunction hf = Sha256HashFunction.INSTANCE;
        final Sha256Digest left = hf.hash("a");
        final Sha256Digest right = hf.hash("b");

        final Sha256Digest combined = hf.combine(left, right);

        assertThat(combined).isEqualTo(hf.hash(left.toString() + right.toString()));
        final byte[] raw = new byte[64];
        System.arraycopy(left.toByteArray(), 0, raw, 0, 32);
        System.arraycopy(right.toByteArray(), 0, raw, 32, 32);
        assertThat(combined).isNotEqualTo(hf.hash(raw));
        assertThat(combined.toString())
                .isEqualTo("0x5415c4936f7265ebfb857a6d6cc5ce36d2aa7ecbc4d69a5390f135f54879f7bc");
    }

    @Test
    @DisplayName("Combine is order sensitive")
    void testCombineOrder() {
        final Sha3HashFunction hf = Sha3HashFunction.INSTANCE;
        final Sha3Digest a = hf.hash("a");
        final Sha3Digest b = hf.hash("b");
        assertThat(hf.combine(a, b)).isNotEqualTo(hf.combine(b, a));
    }

    @Test
    @DisplayName("The two families produce different digests for the same input")
    void testFamiliesDiffer() {
        final byte[] sha256 = Sha256HashFunction.INSTANCE.hash("leaf").toByteArray();
        final byte[] sha3 = Sha3HashFunction.INSTANCE.hash("leaf").toByteArray();
        assertThat(sha256).isNotEqualTo(sha3);
        assertThat(Sha256HashFunction.INSTANCE.algorithm()).isEqualTo("SHA-256");
        assertThat(Sha3HashFunction.INSTANCE.algorithm()).isEqualTo("SHA3-256");
    }

    @Test
    @DisplayName("Wrap accepts 32 bytes and rejects any other length")
    void testWrap() {
        final byte[] bytes = Sha256HashFunction.INSTANCE.hash("x").toByteArray();
        assertThat(Sha256HashFunction.INSTANCE.wrap(bytes)).isEqualTo(Sha256HashFunction.INSTANCE.hash("x"));
        assertThatIllegalArgumentException().isThrownBy(() -> Sha256HashFunction.INSTANCE.wrap(new byte[31]));
        assertThatIllegalArgumentException().isThrownBy(() -> Sha3HashFunction.INSTANCE.wrap(new byte[48]));
    }

    private static <D extends Digest> String encodeHash(final HashFunction<D> hashFunction, final String data) {
        return hashFunction.encode(hashFunction.hash(data));
    }
}
