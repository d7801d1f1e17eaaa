// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.syntax;

import whiletree.tree.Tree;

/**
 * The base interface for core expressions. Expressions are immutable.
 */
public sealed interface Expression {
    /**
     * Returns the expression reading the given variable.
     */
    static Expression var(final Name name) {
        return new Var(name);
    }

    /**
     * Returns the literal expression {@code nil}.
     */
    static Expression nil() {
        return new Literal(Tree.nil());
    }

    /**
     * A variable reference.
     */
    record Var(Name name) implements Expression {
    }

    /**
     * A literal (quoted) tree.
     */
    record Literal(Tree value) implements Expression {
    }

    /**
     * Pair construction, {@code cons head tail}.
     */
    record Cons(Expression head, Expression tail) implements Expression {
    }

    /**
     * Head projection, {@code hd operand}.
     */
    record Head(Expression operand) implements Expression {
    }

    /**
     * Tail projection, {@code tl operand}.
     */
    record Tail(Expression operand) implements Expression {
    }

    /**
     * Structural equality test, {@code left = right}.
     */
    record IsEqual(Expression left, Expression right) implements Expression {
    }
}
