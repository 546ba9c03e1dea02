// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.tools.commands;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.hiero.merkle.common.hasher.HashFamily;
import org.hiero.merkle.common.utils.Preconditions;
import picocli.CommandLine.Option;

/**
 * Options shared by the commands that hash a list of leaves. Leaves given with {@code --leaf} come first, followed by
 * the lines of {@code --file}.
 */
public class LeafOptions {
    @Option(
            names = {"-H", "--hash"},
            description = "Hash family: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "SHA256")
    HashFamily hashFamily = HashFamily.SHA256;

    @Option(
            names = {"-l", "--leaf"},
            description = "Leaf value, hashed as UTF-8 text. May be repeated.")
    List<String> leaves = new ArrayList<>();

    @Option(
            names = {"-f", "--file"},
            description = "UTF-8 text file with one leaf per line")
    Path file;

    /**
     * @return the selected hash family
     */
    public HashFamily hashFamily() {
        return hashFamily;
    }

    /**
     * Collect the leaf values from the command line and the leaf file.
     *
     * @return the leaf values, in order
     * @throws IllegalArgumentException if the leaf file is not an existing regular file
     * @throws IOException if the leaf file cannot be read
     */
    public List<String> readLeaves() throws IOException {
        final List<String> all = new ArrayList<>(leaves);
        if (file != null) {
            all.addAll(Files.readAllLines(Preconditions.requireRegularFile(file), StandardCharsets.UTF_8));
        }
        return all;
    }
}
