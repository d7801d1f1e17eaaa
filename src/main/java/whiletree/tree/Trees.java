// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.tree;

import java.util.ArrayList;
import java.util.List;
import whiletree.util.annotation.Nullable;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * The canonical encodings of naturals, lists and booleans as trees, and their decoders.
 * <p>
 * The natural {@code n} is a chain of {@code n} pairs with nil heads, ending in nil: {@code 0 = nil},
 * {@code k + 1 = <nil.k>}. A list is a chain of pairs whose heads are the elements, ending in nil. Decoders return
 * {@code null} when the tree doesn't have the expected shape; they never throw.
 */
public final class Trees {
    private Trees() {
    }

    /**
     * The tree used as the canonical "true": {@code <nil.nil>}, which is also the natural 1.
     */
    public static final Tree TRUE = Tree.cons(Tree.nil(), Tree.nil());

    /**
     * Encodes the given natural number.
     *
     * @throws IllegalArgumentException if {@code n} is negative.
     */
    @CheckReturnValue
    public static Tree fromNatural(final int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Only naturals have a tree encoding, got " + n);
        }
        var result = Tree.nil();
        for (int i = 0; i < n; i += 1) {
            result = Tree.cons(Tree.nil(), result);
        }
        return result;
    }

    /**
     * Returns the natural number the given {@code tree} encodes, or {@code null} if it doesn't encode one.
     */
    public static @Nullable Integer asNatural(final Tree tree) {
        int count = 0;
        var current = tree;
        while (current instanceof Tree.Cons pair) {
            if (!pair.head().isNil()) {
                return null;
            }
            count += 1;
            current = pair.tail();
        }
        return count;
    }

    /**
     * Encodes the given elements as a list.
     */
    @CheckReturnValue
    public static Tree fromList(final List<Tree> elements) {
        var result = Tree.nil();
        for (int i = elements.size() - 1; i >= 0; i -= 1) {
            result = Tree.cons(elements.get(i), result);
        }
        return result;
    }

    /**
     * Encodes the given elements as a list.
     */
    @CheckReturnValue
    public static Tree listOf(final Tree... elements) {
        return fromList(List.of(elements));
    }

    /**
     * Returns the elements of the list the given {@code tree} encodes.
     * <p>
     * Every tree is a list: following tails always ends in nil. Nil itself is the empty list.
     */
    public static List<Tree> asList(final Tree tree) {
        final var elements = new ArrayList<Tree>();
        var current = tree;
        while (current instanceof Tree.Cons pair) {
            elements.add(pair.head());
            current = pair.tail();
        }
        return List.copyOf(elements);
    }

    /**
     * Returns the elements of the list the given {@code tree} encodes, or {@code null} if it doesn't have exactly
     * {@code size} elements.
     */
    public static @Nullable List<Tree> asListOfSize(final Tree tree, final int size) {
        final var elements = asList(tree);
        return (elements.size() == size) ? elements : null;
    }

    /**
     * Encodes the given boolean: {@link #TRUE} or nil.
     */
    public static Tree fromBoolean(final boolean value) {
        return value ? TRUE : Tree.nil();
    }
}
