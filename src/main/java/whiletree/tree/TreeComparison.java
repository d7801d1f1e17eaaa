// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.tree;

/**
 * Structural equality, hashing, ordering and printing of trees, iterating along tail spines.
 */
final class TreeComparison {
    private TreeComparison() {
    }

    static boolean equal(final Tree left, final Tree right) {
        var a = left;
        var b = right;
        while (a != b) {
            if (a instanceof Tree.Cons consA && b instanceof Tree.Cons consB) {
                if (!equal(consA.head(), consB.head())) {
                    return false;
                }
                a = consA.tail();
                b = consB.tail();
            } else {
                return false;
            }
        }
        return true;
    }

    static int hash(final Tree.Cons cons) {
        int result = 1;
        Tree current = cons;
        while (current instanceof Tree.Cons pair) {
            result = 31 * result + pair.head().hashCode();
            current = pair.tail();
        }
        return 31 * result + nilHash;
    }

    static int compare(final Tree left, final Tree right) {
        var a = left;
        var b = right;
        while (a != b) {
            if (a.isNil()) {
                return -1;
            } else if (b.isNil()) {
                return 1;
            }
            final var headOrder = compare(a.head(), b.head());
            if (headOrder != 0) {
                return headOrder;
            }
            a = a.tail();
            b = b.tail();
        }
        return 0;
    }

    static void appendDotted(final StringBuilder builder, final Tree tree) {
        int openPairs = 0;
        var current = tree;
        while (current instanceof Tree.Cons pair) {
            builder.append('<');
            appendDotted(builder, pair.head());
            builder.append('.');
            openPairs += 1;
            current = pair.tail();
        }
        builder.append("nil");
        builder.append(">".repeat(openPairs));
    }

    static final int nilHash = 0x6e696c;
}
