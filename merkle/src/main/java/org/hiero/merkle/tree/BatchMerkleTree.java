// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.tree;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.hiero.merkle.common.hasher.Digest;
import org.hiero.merkle.common.hasher.HashFunction;

/**
 * Computes the Merkle root of a complete list of leaf digests.
 * <p>
 * The list is reduced one level at a time. A level with an odd number of nodes is padded by duplicating its last
 * node, so a lone node is combined with itself. Parents are {@link HashFunction#combine(Digest, Digest)} of their
 * two children, left first. The root of an empty list is the zero digest and the root of a single leaf is that leaf.
 * <p>
 * This class holds no mutable state and is safe to share between threads.
 *
 * @param <D> the digest type
 */
public final class BatchMerkleTree<D extends Digest> {
    /** The hash function used to combine nodes. */
    private final HashFunction<D> hashFunction;

    /**
     * Create a batch tree over the given hash function.
     *
     * @param hashFunction the hash function used to combine nodes
     */
    public BatchMerkleTree(@NonNull final HashFunction<D> hashFunction) {
        this.hashFunction = Objects.requireNonNull(hashFunction);
    }

    /**
     * Compute the root of the given leaves. The list is not modified.
     *
     * @param leaves the leaf digests, in order
     * @return the Merkle root, or the zero digest if there are no leaves
     * @throws NullPointerException if the list or any leaf is null
     */
    public D root(@NonNull final List<D> leaves) {
        Objects.requireNonNull(leaves, "leaves must not be null");
        if (leaves.isEmpty()) {
            return hashFunction.zero();
        }
        List<D> level = new ArrayList<>(leaves.size() + 1);
        for (final D leaf : leaves) {
            level.add(Objects.requireNonNull(leaf, "leaf must not be null"));
        }
        while (level.size() > 1) {
            if ((level.size() & 1) == 1) {
                level.add(level.get(level.size() - 1));
            }
            final List<D> next = new ArrayList<>(level.size() / 2 + 1);
            for (int i = 0; i < level.size(); i += 2) {
                next.add(hashFunction.combine(level.get(i), level.get(i + 1)));
            }
            level = next;
        }
        return level.get(0);
    }

    /**
     * Compute the root of the given leaves.
     *
     * @param leaves the leaf digests, in order
     * @return the Merkle root, or the zero digest if there are no leaves
     */
    @SafeVarargs
    public final D root(@NonNull final D... leaves) {
        return root(Arrays.asList(leaves));
    }

    /**
     * Hash raw leaf data into leaf digests with this tree's hash function.
     *
     * @param leafData the raw data of each leaf, in order
     * @return the leaf digests, in the same order
     */
    public List<D> hashLeaves(@NonNull final List<byte[]> leafData) {
        final List<D> hashed = new ArrayList<>(leafData.size());
        for (final byte[] data : leafData) {
            hashed.add(hashFunction.hash(data));
        }
        return hashed;
    }
}
