// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.encoding;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import whiletree.syntax.Command;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;
import whiletree.syntax.Printer;
import whiletree.syntax.Program;
import whiletree.tree.Tree;
import whiletree.tree.Trees;
import whiletree.util.Trace;
import whiletree.util.UnreachableCodeReachedError;
import whiletree.util.condition.ConditionContext;
import whiletree.util.condition.UnhandledErrorError;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * Encodes core syntax as trees, the "programs as data" convention a self-interpreter relies on.
 * <p>
 * The encoding, with every list encoded as by {@link Trees#fromList(List)}:
 * <ul>
 * <li>a program is {@code [read, block, write]};
 * <li>a block is the list of its encoded commands;
 * <li>commands are {@code [@asgn, variable, expression]}, {@code [@while, guard, block]} and
 * {@code [@if, guard, trueBlock, falseBlock]};
 * <li>expressions are {@code [@var, variable]}, {@code [@quote, tree]}, {@code [@hd, e]}, {@code [@tl, e]} and
 * {@code [@cons, e1, e2]};
 * <li>variables are naturals, numbered from zero in order of first occurrence: for a program the read variable
 * comes first, then the block in order, then the write variable.
 * </ul>
 * The vocabulary has no tag for equality tests. Quoting syntax containing one signals a fatal
 * {@link UnencodableSyntaxCondition}.
 */
public final class Quoter {
    private Quoter() {
    }

    /**
     * Encodes the given program.
     */
    @CheckReturnValue
    public static Tree quote(final Program program) {
        try (final var trace = new Trace(() -> "Quoting program " + program.file())) {
            trace.use();
            final var quoter = new Quoter();
            final var read = quoter.variable(program.readVariable());
            final var block = quoter.block(program.block());
            final var write = quoter.variable(program.writeVariable());
            return Trees.listOf(read, block, write);
        }
    }

    /**
     * Encodes the given command, numbering its variables by first occurrence within it.
     */
    @CheckReturnValue
    public static Tree quote(final Command command) {
        return new Quoter().command(command);
    }

    /**
     * Encodes the given expression, numbering its variables by first occurrence within it.
     */
    @CheckReturnValue
    public static Tree quote(final Expression expression) {
        return new Quoter().expression(expression);
    }

    private Tree block(final List<Command> block) {
        final var commands = new ArrayList<Tree>(block.size());
        for (final var command : block) {
            commands.add(command(command));
        }
        return Trees.fromList(commands);
    }

    private Tree command(final Command command) {
        if (command instanceof Command.Assign assign) {
            final var variable = variable(assign.variable());
            return Trees.listOf(Atom.ASSIGN.tree(), variable, expression(assign.value()));
        } else if (command instanceof Command.While loop) {
            final var guard = expression(loop.guard());
            return Trees.listOf(Atom.WHILE.tree(), guard, block(loop.body()));
        } else if (command instanceof Command.IfElse conditional) {
            final var guard = expression(conditional.guard());
            final var trueBlock = block(conditional.trueBlock());
            final var falseBlock = block(conditional.falseBlock());
            return Trees.listOf(Atom.IF.tree(), guard, trueBlock, falseBlock);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private Tree expression(final Expression expression) {
        if (expression instanceof Expression.Var reference) {
            return Trees.listOf(Atom.VAR.tree(), variable(reference.name()));
        } else if (expression instanceof Expression.Literal literal) {
            return Trees.listOf(Atom.QUOTE.tree(), literal.value());
        } else if (expression instanceof Expression.Cons cons) {
            final var head = expression(cons.head());
            return Trees.listOf(Atom.CONS.tree(), head, expression(cons.tail()));
        } else if (expression instanceof Expression.Head head) {
            return Trees.listOf(Atom.HEAD.tree(), expression(head.operand()));
        } else if (expression instanceof Expression.Tail tail) {
            return Trees.listOf(Atom.TAIL.tree(), expression(tail.operand()));
        } else if (expression instanceof Expression.IsEqual) {
            throw signalUnencodable("Equality tests have no tree encoding: " + Printer.print(expression));
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private Tree variable(final Name name) {
        final var number = variableNumbers.computeIfAbsent(name, key -> variableNumbers.size());
        return Trees.fromNatural(number);
    }

    private static UnhandledErrorError signalUnencodable(final String message) {
        throw ConditionContext.error(new UnencodableSyntaxCondition(message));
    }

    private final HashMap<Name, Integer> variableNumbers = new HashMap<>();
}
