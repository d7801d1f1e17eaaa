// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.tree;

/**
 * A While tree value: either the empty leaf {@link Nil}, or a pair {@link Cons} of two trees.
 * <p>
 * Trees are immutable and compared structurally. They're totally ordered: nil sorts before every pair, and pairs
 * compare their heads first, then their tails.
 * <p>
 * Numerals and lists are long right-nested chains, so equality, hashing, ordering and {@link #toString()} walk the
 * tail spine iteratively and only recurse into heads.
 */
public sealed interface Tree extends Comparable<Tree> {
    /**
     * Returns the empty leaf.
     */
    static Tree nil() {
        return Nil.NIL;
    }

    /**
     * Returns the pair of the given trees.
     */
    static Tree cons(final Tree head, final Tree tail) {
        return new Cons(head, tail);
    }

    /**
     * Returns {@code true} iff this tree is the empty leaf.
     */
    default boolean isNil() {
        return this == Nil.NIL;
    }

    /**
     * Returns the left child of a pair, or nil for nil itself, matching the semantics of {@code hd}.
     */
    Tree head();

    /**
     * Returns the right child of a pair, or nil for nil itself, matching the semantics of {@code tl}.
     */
    Tree tail();

    /**
     * The empty leaf. There is exactly one instance.
     */
    final class Nil implements Tree {
        private Nil() {
        }

        @Override
        public Tree head() {
            return this;
        }

        @Override
        public Tree tail() {
            return this;
        }

        @Override
        public int hashCode() {
            return TreeComparison.nilHash;
        }

        @Override
        public String toString() {
            return "nil";
        }

        private static final Nil NIL = new Nil();
    }

    /**
     * A pair of two trees.
     */
    final class Cons implements Tree {
        private Cons(final Tree head, final Tree tail) {
            this.head = head;
            this.tail = tail;
        }

        @Override
        public Tree head() {
            return head;
        }

        @Override
        public Tree tail() {
            return tail;
        }

        @Override
        public boolean equals(final Object other) {
            return other instanceof Tree tree && TreeComparison.equal(this, tree);
        }

        @Override
        public int hashCode() {
            var hash = cachedHash;
            if (hash == 0) {
                hash = TreeComparison.hash(this);
                cachedHash = hash;
            }
            return hash;
        }

        @Override
        public String toString() {
            final var builder = new StringBuilder();
            TreeComparison.appendDotted(builder, this);
            return builder.toString();
        }

        private final Tree head;
        private final Tree tail;
        // Benign data race: every thread computes the same value.
        private int cachedHash = 0;
    }

    @Override
    default int compareTo(final Tree other) {
        return TreeComparison.compare(this, other);
    }
}
