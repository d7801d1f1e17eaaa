// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.encoding;

import whiletree.tree.Tree;
import whiletree.tree.Trees;

/**
 * Renders tree values as human-readable text.
 * <p>
 * Every renderer shows a tree that encodes a natural as that decimal number. They differ in what they do with other
 * trees. Nil is the natural zero, so it renders as {@code 0} everywhere except inside the dotted notation.
 */
public final class TreeRenderer {
    private TreeRenderer() {
    }

    /**
     * Renders the given tree in the given mode.
     */
    public static String render(final Tree tree, final RenderMode mode) {
        return switch (mode) {
            case RAW -> integer(tree, true);
            case NESTED_LIST -> nestedList(tree);
            case ATOM_TAGGED -> atomTagged(tree);
        };
    }

    /**
     * Renders the given tree as a natural. A tree that isn't one is shown in dotted pair notation if {@code verbose}
     * is set, or as {@code E} otherwise.
     */
    public static String integer(final Tree tree, final boolean verbose) {
        final var natural = Trees.asNatural(tree);
        if (natural != null) {
            return natural.toString();
        }
        return verbose ? tree.toString() : "E";
    }

    /**
     * Renders the given tree as a list of naturals, each element rendered as by {@link #integer(Tree, boolean)}.
     */
    public static String integerList(final Tree tree, final boolean verbose) {
        final var builder = new StringBuilder();
        builder.append('[');
        var first = true;
        for (final var element : Trees.asList(tree)) {
            if (!first) {
                builder.append(", ");
            }
            first = false;
            builder.append(integer(element, verbose));
        }
        builder.append(']');
        return builder.toString();
    }

    /**
     * Renders the given tree as a natural if it is one, otherwise as a list of recursively rendered elements.
     */
    public static String nestedList(final Tree tree) {
        final var builder = new StringBuilder();
        appendNested(builder, tree, false);
        return builder.toString();
    }

    /**
     * Renders the given tree like {@link #nestedList(Tree)}, except that the first element of every list is shown as
     * its atom symbol, such as {@code @while}, when it encodes an atom.
     */
    public static String atomTagged(final Tree tree) {
        final var builder = new StringBuilder();
        appendNested(builder, tree, true);
        return builder.toString();
    }

    private static void appendNested(final StringBuilder builder, final Tree tree, final boolean tagAtoms) {
        final var natural = Trees.asNatural(tree);
        if (natural != null) {
            builder.append(natural);
            return;
        }
        builder.append('[');
        var first = true;
        for (final var element : Trees.asList(tree)) {
            if (first) {
                final var atom = tagAtoms ? Atom.byTree(element) : null;
                if (atom != null) {
                    builder.append(atom.symbol());
                } else {
                    appendNested(builder, element, tagAtoms);
                }
                first = false;
            } else {
                builder.append(", ");
                appendNested(builder, element, tagAtoms);
            }
        }
        builder.append(']');
    }
}
