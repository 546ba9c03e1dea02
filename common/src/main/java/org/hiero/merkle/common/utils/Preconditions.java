// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.common.utils;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** A utility class used to assert various preconditions. */
public final class Preconditions {
    private static final String DEFAULT_REQUIRE_EXACT_LENGTH_MESSAGE =
            "The input array of length [%d] is required to be exactly [%d] bytes long.";
    private static final String DEFAULT_REQUIRE_REGULAR_FILE_MESSAGE =
            "The input path [%s] is required to be an existing regular file.";

    private Preconditions() {
        throw new UnsupportedOperationException("Utility Class");
    }

    /**
     * This method asserts a given byte array is not {@code null} and has exactly the expected length.
     *
     * @param toCheck the array to check
     * @param expectedLength the required length
     * @return the input array if the check passes
     * @throws NullPointerException if the input array is {@code null}
     * @throws IllegalArgumentException if the input array length differs from the expected length
     */
    public static byte[] requireExactLength(final byte[] toCheck, final int expectedLength) {
        Objects.requireNonNull(toCheck);
        if (toCheck.length != expectedLength) {
            throw new IllegalArgumentException(
                    DEFAULT_REQUIRE_EXACT_LENGTH_MESSAGE.formatted(toCheck.length, expectedLength));
        }
        return toCheck;
    }

    /**
     * This method asserts a given {@link Path} points to an existing regular file.
     *
     * @param toCheck the path to check
     * @return the input path if the check passes
     * @throws NullPointerException if the input path is {@code null}
     * @throws IllegalArgumentException if the input path is not an existing regular file
     */
    public static Path requireRegularFile(@NonNull final Path toCheck) {
        Objects.requireNonNull(toCheck);
        if (!Files.isRegularFile(toCheck)) {
            throw new IllegalArgumentException(DEFAULT_REQUIRE_REGULAR_FILE_MESSAGE.formatted(toCheck));
        }
        return toCheck;
    }
}
