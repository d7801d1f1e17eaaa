// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.encoding;

import java.util.HashMap;
import java.util.Map;
import whiletree.tree.Tree;
import whiletree.tree.Trees;
import whiletree.util.annotation.Nullable;

/**
 * The fixed vocabulary of syntax-node tags used when programs are encoded as trees.
 * <p>
 * Each atom is encoded as the natural number given by its code: the first fourteen primes, in declaration order.
 * The codes are part of the wire format of encoded programs and must never change. The {@code do*} atoms mark the
 * continuation stack of a self-interpreter; quoting never emits them.
 */
public enum Atom {
    ASSIGN("@asgn", 2),
    DO_ASSIGN("@doAsgn", 3),
    WHILE("@while", 5),
    DO_WHILE("@doWhile", 7),
    IF("@if", 11),
    DO_IF("@doIf", 13),
    VAR("@var", 17),
    QUOTE("@quote", 19),
    HEAD("@hd", 23),
    DO_HEAD("@doHd", 29),
    TAIL("@tl", 31),
    DO_TAIL("@doTl", 37),
    CONS("@cons", 41),
    DO_CONS("@doCons", 43);

    Atom(final String symbol, final int code) {
        this.symbol = symbol;
        this.code = code;
        tree = Trees.fromNatural(code);
    }

    /**
     * Returns the atom with the given integer code, or {@code null} if the code isn't an atom.
     */
    public static @Nullable Atom byCode(final int code) {
        return byCode.get(code);
    }

    /**
     * Returns the atom with the given symbol, such as {@code @while}, or {@code null} if there is no such atom.
     */
    public static @Nullable Atom bySymbol(final String symbol) {
        return bySymbol.get(symbol);
    }

    /**
     * Returns the atom the given tree encodes, or {@code null} if it doesn't encode one.
     */
    public static @Nullable Atom byTree(final Tree tree) {
        final var natural = Trees.asNatural(tree);
        return (natural != null) ? byCode(natural) : null;
    }

    /**
     * Retrieves the integer code of this atom.
     */
    public int code() {
        return code;
    }

    /**
     * Retrieves the symbolic spelling of this atom, as rendered in atom-tagged mode.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Retrieves the tree encoding this atom.
     */
    public Tree tree() {
        return tree;
    }

    @Override
    public String toString() {
        return symbol;
    }

    private static final Map<Integer, Atom> byCode = new HashMap<>();
    private static final Map<String, Atom> bySymbol = new HashMap<>();

    static {
        for (final var atom : values()) {
            byCode.put(atom.code, atom);
            bySymbol.put(atom.symbol, atom);
        }
    }

    private final String symbol;
    private final int code;
    private final Tree tree;
}
