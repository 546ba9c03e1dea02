// SPDX-License-Identifier: Apache-2.0
package org.hiero.merkle.tree;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.hiero.merkle.common.hasher.Digest;
import org.hiero.merkle.common.hasher.HashFunction;

/**
 * Computes the Merkle root of a growing list of leaves one leaf at a time, keeping one slot per tree level instead
 * of the whole tree. After each {@link #feed(Digest)} the returned root equals what {@link BatchMerkleTree} computes
 * over every leaf fed so far.
 * <p>
 * A slot holds either the zero digest (empty) or a left node waiting for its right sibling. Feeding a leaf walks up
 * the levels much like incrementing a binary counter:
 * <ul>
 *   <li>an empty slot stores the incoming node and the walk continues upward as a projection only, pairing the node
 *       with itself the way an odd level is padded in the batch tree</li>
 *   <li>an occupied slot pairs with the incoming node (stored node on the left); the slot is cleared and the parent
 *       is carried to the next level as a real new node</li>
 *   <li>past the last slot the walk ends and the carried node is the root; a new top slot is appended only while
 *       every existing slot is empty</li>
 * </ul>
 * Only the part of the walk that follows a carry mutates slots. The projection part reads them.
 * <p>
 * The slot vector can be saved with {@link #slots()} and restored with {@link #load(HashFunction, List)}. A restored
 * tree does not know its current root until the next leaf is fed, so callers that need it must save it separately.
 * <p>This is not thread safe, it is assumed use by single thread.</p>
 *
 * @param <D> the digest type
 */
public final class IncrementalMerkleTree<D extends Digest> {
    private static final System.Logger LOGGER = System.getLogger(IncrementalMerkleTree.class.getName());

    /** The hash function used to combine nodes. */
    private final HashFunction<D> hashFunction;
    /** One slot per level, level 0 is the leaf level. */
    private final List<D> slots;
    /** The root returned by the latest feed. */
    private D currentRoot;

    /**
     * Create an empty tree.
     *
     * @param hashFunction the hash function used to combine nodes
     */
    public IncrementalMerkleTree(@NonNull final HashFunction<D> hashFunction) {
        this(hashFunction, List.of());
    }

    private IncrementalMerkleTree(@NonNull final HashFunction<D> hashFunction, @NonNull final List<D> savedSlots) {
        this.hashFunction = Objects.requireNonNull(hashFunction);
        this.slots = new ArrayList<>(savedSlots.size() + 1);
        for (final D slot : savedSlots) {
            slots.add(Objects.requireNonNull(slot, "slot must not be null"));
        }
        this.currentRoot = hashFunction.zero();
    }

    /**
     * Create a tree from a slot vector previously returned by {@link #slots()}. The list is copied. The current root
     * of the new tree is the zero digest.
     *
     * @param hashFunction the hash function used to combine nodes
     * @param savedSlots the saved slot vector, empty slots included
     * @param <D> the digest type
     * @return the restored tree
     * @throws NullPointerException if the list or any slot is null
     */
    public static <D extends Digest> IncrementalMerkleTree<D> load(
            @NonNull final HashFunction<D> hashFunction, @NonNull final List<D> savedSlots) {
        Objects.requireNonNull(savedSlots, "savedSlots must not be null");
        return new IncrementalMerkleTree<>(hashFunction, savedSlots);
    }

    /**
     * Add the next leaf and return the new root.
     *
     * @param leaf the leaf digest
     * @return the root over every leaf fed so far
     * @throws NullPointerException if the leaf is null
     */
    public D feed(@NonNull final D leaf) {
        Objects.requireNonNull(leaf, "leaf must not be null");
        D value = leaf;
        // true while the walk follows the real insertion path, false once it only projects the root
        boolean authoritative = true;
        for (int level = 0; ; level++) {
            if (slots.size() <= level) {
                if (allSlotsEmpty()) {
                    slots.add(value);
                    LOGGER.log(DEBUG, "Appended slot for level {0}", level);
                }
                currentRoot = value;
                return value;
            }
            final D stored = slots.get(level);
            if (stored.isZero()) {
                final D parent = hashFunction.combine(value, value);
                if (authoritative) {
                    slots.set(level, value);
                    authoritative = false;
                }
                LOGGER.log(TRACE, "Level {0} empty, padded {1}", level, value);
                value = parent;
            } else {
                final D parent = hashFunction.combine(stored, value);
                if (authoritative) {
                    slots.set(level, hashFunction.zero());
                }
                LOGGER.log(TRACE, "Level {0} paired {1} with {2}", level, stored, value);
                value = parent;
            }
        }
    }

    /**
     * @return the root returned by the latest {@link #feed(Digest)}, or the zero digest if there was none
     */
    public D currentRoot() {
        return currentRoot;
    }

    /**
     * @return an unmodifiable copy of the slot vector, index is the tree level
     */
    public List<D> slots() {
        return List.copyOf(slots);
    }

    /**
     * @return the number of levels with a slot
     */
    public int height() {
        return slots.size();
    }

    private boolean allSlotsEmpty() {
        for (final D slot : slots) {
            if (!slot.isZero()) {
                return false;
            }
        }
        return true;
    }
}
