// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.syntax;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import whiletree.util.UnreachableCodeReachedError;

/**
 * Enumeration of the variable names syntax refers to.
 */
public final class Names {
    private Names() {
    }

    /**
     * Returns every name the program refers to, including its read and write variables, in {@link Name} order.
     */
    public static SortedSet<Name> of(final Program program) {
        final var names = new TreeSet<Name>();
        names.add(program.readVariable());
        collect(program.block(), names);
        names.add(program.writeVariable());
        return Collections.unmodifiableSortedSet(names);
    }

    /**
     * Returns every name the command refers to, in {@link Name} order.
     */
    public static SortedSet<Name> of(final Command command) {
        final var names = new TreeSet<Name>();
        collect(command, names);
        return Collections.unmodifiableSortedSet(names);
    }

    /**
     * Returns every name the expression refers to, in {@link Name} order.
     */
    public static SortedSet<Name> of(final Expression expression) {
        final var names = new TreeSet<Name>();
        collect(expression, names);
        return Collections.unmodifiableSortedSet(names);
    }

    private static void collect(final List<Command> block, final TreeSet<Name> names) {
        for (final var command : block) {
            collect(command, names);
        }
    }

    private static void collect(final Command command, final TreeSet<Name> names) {
        if (command instanceof Command.Assign assign) {
            names.add(assign.variable());
            collect(assign.value(), names);
        } else if (command instanceof Command.While loop) {
            collect(loop.guard(), names);
            collect(loop.body(), names);
        } else if (command instanceof Command.IfElse conditional) {
            collect(conditional.guard(), names);
            collect(conditional.trueBlock(), names);
            collect(conditional.falseBlock(), names);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private static void collect(final Expression expression, final TreeSet<Name> names) {
        if (expression instanceof Expression.Var reference) {
            names.add(reference.name());
        } else if (expression instanceof Expression.Literal) {
            return;
        } else if (expression instanceof Expression.Cons cons) {
            collect(cons.head(), names);
            collect(cons.tail(), names);
        } else if (expression instanceof Expression.Head head) {
            collect(head.operand(), names);
        } else if (expression instanceof Expression.Tail tail) {
            collect(tail.operand(), names);
        } else if (expression instanceof Expression.IsEqual isEqual) {
            collect(isEqual.left(), names);
            collect(isEqual.right(), names);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }
}
