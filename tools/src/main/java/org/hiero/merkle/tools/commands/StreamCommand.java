// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.tools.commands;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.hiero.merkle.common.hasher.Digest;
import org.hiero.merkle.common.hasher.HashFunction;
import org.hiero.merkle.common.hasher.HashingUtilities;
import org.hiero.merkle.common.utils.Preconditions;
import org.hiero.merkle.tree.BatchMerkleTree;
import org.hiero.merkle.tree.IncrementalMerkleTree;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Subcommand that feeds leaves one at a time into an {@link IncrementalMerkleTree} and prints the root after each
 * leaf. For example:
 * <pre>
 * $ merkle-tool stream -l a -l b --slots
 * 1 0xca978112ca1bbdcafac231b39a23dc4da786eff8147c4e72b9807785afee48bb
 * 2 0x5415c4936f7265ebfb857a6d6cc5ce36d2aa7ecbc4d69a5390f135f54879f7bc
 * slot 0 0x0000000000000000000000000000000000000000000000000000000000000000
 * slot 1 0x5415c4936f7265ebfb857a6d6cc5ce36d2aa7ecbc4d69a5390f135f54879f7bc
 * </pre>
 * The slot lines can be saved to a file and given back with {@code --restore}; only the last token of each line is
 * read, so bare encoded digests work too.
 */
@Command(
        name = "stream",
        mixinStandardHelpOptions = true,
        description = "Feed leaves one at a time and print the root after each one")
public class StreamCommand implements Callable<Integer> {
    private static final System.Logger LOGGER = System.getLogger(StreamCommand.class.getName());

    @Mixin
    LeafOptions leafOptions;

    @Option(
            names = {"--verify"},
            description = "Recompute the batch root for every prefix and fail on any difference")
    boolean verify;

    @Option(
            names = {"--slots"},
            description = "Print the slot vector after the last leaf")
    boolean printSlots;

    @Option(
            names = {"--restore"},
            description = "File with a saved slot vector, one encoded digest per line, to continue from")
    Path restoreFile;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        try {
            return stream(leafOptions.hashFamily().hashFunction());
        } catch (final IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (final IOException e) {
            LOGGER.log(ERROR, "Failed to read input", e);
            return 1;
        }
    }

    private <D extends Digest> int stream(final HashFunction<D> hashFunction) throws IOException {
        final List<String> leaves = leafOptions.readLeaves();
        final IncrementalMerkleTree<D> tree = restoreFile == null
                ? new IncrementalMerkleTree<>(hashFunction)
                : IncrementalMerkleTree.load(hashFunction, readSlots(hashFunction, restoreFile));
        if (verify && restoreFile != null) {
            LOGGER.log(INFO, "Verification skipped, the leaves before the restored state are unknown");
        }
        final BatchMerkleTree<D> batch = new BatchMerkleTree<>(hashFunction);
        final List<D> fed = new ArrayList<>(leaves.size());
        final PrintWriter out = spec.commandLine().getOut();
        int exitCode = 0;
        for (final String leaf : leaves) {
            final D digest = hashFunction.hash(leaf);
            fed.add(digest);
            final D root = tree.feed(digest);
            out.println(fed.size() + " " + hashFunction.encode(root));
            if (verify && restoreFile == null) {
                final D expected = batch.root(fed);
                if (!expected.equals(root)) {
                    LOGGER.log(
                            ERROR,
                            "Root after {0} leaves differs, incremental {1} batch {2}",
                            fed.size(),
                            root,
                            expected);
                    exitCode = 1;
                }
            }
        }
        if (printSlots) {
            final List<D> slots = tree.slots();
            for (int level = 0; level < slots.size(); level++) {
                out.println("slot " + level + " " + hashFunction.encode(slots.get(level)));
            }
        }
        out.flush();
        LOGGER.log(DEBUG, "Fed {0} leaves, tree height {1}", fed.size(), tree.height());
        return exitCode;
    }

    private static <D extends Digest> List<D> readSlots(final HashFunction<D> hashFunction, final Path file)
            throws IOException {
        final List<D> slots = new ArrayList<>();
        for (final String line : Files.readAllLines(Preconditions.requireRegularFile(file), StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            final String[] parts = line.strip().split("\\s+");
            slots.add(hashFunction.wrap(HashingUtilities.decode(parts[parts.length - 1])));
        }
        return slots;
    }
}
