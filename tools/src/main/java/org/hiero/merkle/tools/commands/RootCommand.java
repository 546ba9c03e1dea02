// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.tools.commands;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.hiero.merkle.common.hasher.Digest;
import org.hiero.merkle.common.hasher.HashFunction;
import org.hiero.merkle.tree.BatchMerkleTree;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Subcommand to print the Merkle root of a complete list of leaves. For example:
 * <pre>
 * $ merkle-tool root -l a -l b
 * 0x5415c4936f7265ebfb857a6d6cc5ce36d2aa7ecbc4d69a5390f135f54879f7bc
 * </pre>
 */
@Command(name = "root", mixinStandardHelpOptions = true, description = "Print the Merkle root of all leaves")
public class RootCommand implements Callable<Integer> {
    private static final System.Logger LOGGER = System.getLogger(RootCommand.class.getName());

    @Mixin
    LeafOptions leafOptions;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        final List<String> leaves;
        try {
            leaves = leafOptions.readLeaves();
        } catch (final IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (final IOException e) {
            LOGGER.log(ERROR, "Failed to read leaves", e);
            return 1;
        }
        LOGGER.log(DEBUG, "Computing batch root of {0} leaves with {1}", leaves.size(), leafOptions.hashFamily());
        final PrintWriter out = spec.commandLine().getOut();
        out.println(root(leafOptions.hashFamily().hashFunction(), leaves));
        out.flush();
        return 0;
    }

    private static <D extends Digest> String root(final HashFunction<D> hashFunction, final List<String> leaves) {
        final List<D> hashed = new ArrayList<>(leaves.size());
        for (final String leaf : leaves) {
            hashed.add(hashFunction.hash(leaf));
        }
        return hashFunction.encode(new BatchMerkleTree<>(hashFunction).root(hashed));
    }
}
