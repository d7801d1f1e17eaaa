// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.tree.reader;

import java.util.ArrayList;
import whiletree.encoding.Atom;
import whiletree.tree.Tree;
import whiletree.tree.Trees;
import whiletree.util.UnreachableCodeReachedError;
import whiletree.util.annotation.Nullable;
import whiletree.util.condition.ConditionContext;
import whiletree.util.condition.UnhandledErrorError;

/**
 * The tree reader: turns text into tree values. It accepts everything the renderers in
 * {@link whiletree.encoding.TreeRenderer} produce:
 * <ul>
 * <li>{@code nil};
 * <li>pairs in dotted notation, {@code <head.tail>};
 * <li>naturals in decimal, such as {@code 3} for {@code <nil.<nil.<nil.nil>>>};
 * <li>lists, {@code [a, b, c]}, where {@code []} is nil;
 * <li>atom symbols such as {@code @while}, read as the natural encoding the atom.
 * </ul>
 * Trees are separated by whitespace.
 */
public final class TreeReader {
    /**
     * Initializes a new tree reader that will read from the given text.
     */
    public TreeReader(final String text) {
        this.text = text;
    }

    /**
     * Reads the given text as exactly one tree.
     * <p>
     * Signals a fatal {@link ReadErrorCondition} if the text is malformed, empty, or has anything after the tree.
     */
    public static Tree read(final String text) {
        final var reader = new TreeReader(text);
        final var tree = reader.readTopLevelForm();
        if (tree == null) {
            throw reader.signalReadError("Expected a tree, but found end of input instead");
        }
        if (reader.readTopLevelForm() != null) {
            throw reader.signalReadError("Expected end of input after the tree");
        }
        return tree;
    }

    /**
     * Attempts to read the next tree.
     *
     * <ul>
     * <li>If a tree was read, it is returned.
     * <li>If the end of input is reached, {@code null} is returned.
     * <li>If the text is malformed, a fatal {@link ReadErrorCondition} is signaled.
     * </ul>
     */
    public @Nullable Tree readTopLevelForm() {
        skipWhitespace();
        if (reachedEnd()) {
            return null;
        }
        formStart = position;
        currentDepth = 0;
        return readForm();
    }

    private Tree readForm() {
        currentDepth += 1;
        try {
            if (currentDepth > maxDepth) {
                throw signalReadError("Nesting limit reached, try to limit nesting");
            }
            skipWhitespace();
            if (reachedEnd()) {
                throw signalReadError("Expected a tree, but found end of input instead");
            }
            final var c = peek();
            if (c == '<') {
                return readPairs();
            } else if (c == '[') {
                return readList();
            } else if (c == '@') {
                return readAtom();
            } else if (isDigit(c)) {
                return readNatural();
            } else if (isLetter(c)) {
                return readNil();
            } else {
                throw signalReadError("Expected a tree, but found '" + c + "' instead");
            }
        } finally {
            currentDepth -= 1;
        }
    }

    // Reads <a.<b.<c.t>>> iteratively along the tail spine, so long lists in dotted notation don't nest.
    private Tree readPairs() {
        final var heads = new ArrayList<Tree>();
        Tree tail;
        while (true) {
            expect('<');
            heads.add(readForm());
            skipWhitespace();
            expect('.');
            skipWhitespace();
            if (!reachedEnd() && peek() == '<') {
                continue;
            }
            tail = readForm();
            break;
        }
        for (int i = heads.size() - 1; i >= 0; i -= 1) {
            skipWhitespace();
            expect('>');
            tail = Tree.cons(heads.get(i), tail);
        }
        return tail;
    }

    private Tree readList() {
        expect('[');
        final var elements = new ArrayList<Tree>();
        skipWhitespace();
        if (!reachedEnd() && peek() == ']') {
            position += 1;
            return Tree.nil();
        }
        while (true) {
            elements.add(readForm());
            skipWhitespace();
            if (reachedEnd()) {
                throw signalReadError("Expected ',' or ']' but found end of input instead");
            }
            final var c = peek();
            position += 1;
            if (c == ']') {
                break;
            } else if (c != ',') {
                throw signalReadError("Expected ',' or ']' but found '" + c + "' instead");
            }
        }
        return Trees.fromList(elements);
    }

    private Tree readAtom() {
        expect('@');
        final var start = position;
        while (!reachedEnd() && isLetter(peek())) {
            position += 1;
        }
        final var symbol = "@" + text.substring(start, position);
        final var atom = Atom.bySymbol(symbol);
        if (atom == null) {
            throw signalReadError("Unknown atom " + symbol);
        }
        return atom.tree();
    }

    private Tree readNatural() {
        final var start = position;
        while (!reachedEnd() && isDigit(peek())) {
            position += 1;
        }
        final var digits = text.substring(start, position);
        final int value;
        try {
            value = Integer.parseInt(digits);
        } catch (final NumberFormatException e) {
            throw signalReadError("Natural " + digits + " is too large");
        }
        if (value > maxNatural) {
            throw signalReadError("Natural " + digits + " is too large, the limit is " + maxNatural);
        }
        return Trees.fromNatural(value);
    }

    private Tree readNil() {
        final var start = position;
        while (!reachedEnd() && isLetter(peek())) {
            position += 1;
        }
        final var word = text.substring(start, position);
        if (!word.equals("nil")) {
            throw signalReadError("Expected a tree, but found '" + word + "' instead");
        }
        return Tree.nil();
    }

    private void expect(final char expected) {
        if (reachedEnd()) {
            throw signalReadError("Expected '" + expected + "' but found end of input instead");
        }
        final var c = peek();
        if (c != expected) {
            throw signalReadError("Expected '" + expected + "' but found '" + c + "' instead");
        }
        position += 1;
    }

    private void skipWhitespace() {
        while (!reachedEnd() && Character.isWhitespace(peek())) {
            position += 1;
        }
    }

    private boolean reachedEnd() {
        return position >= text.length();
    }

    private char peek() {
        if (reachedEnd()) {
            throw new UnreachableCodeReachedError("peek called at end of input");
        }
        return text.charAt(position);
    }

    private UnhandledErrorError signalReadError(final String message) {
        final var location = new SourceLocation(position + 1, formStart + 1);
        throw ConditionContext.error(new ReadErrorCondition(message, location));
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static final int maxDepth = 1_000;
    private static final int maxNatural = 1_000_000;

    private final String text;
    private int position = 0;
    private int formStart = 0;
    private int currentDepth = 0;
}
