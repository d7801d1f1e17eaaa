// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.encoding;

import java.util.ArrayList;
import java.util.List;
import whiletree.syntax.Command;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;
import whiletree.syntax.Printer;
import whiletree.syntax.Program;
import whiletree.tree.Tree;
import whiletree.tree.Trees;
import whiletree.util.annotation.Nullable;

/**
 * Decodes trees produced by the {@link Quoter} back into core syntax, or into source text.
 * <p>
 * Decoding is strict: an unknown tag, a tag with the wrong number of fields, or a field that doesn't decode makes the
 * whole decode fail, and the method returns {@code null}. There are no partial results.
 * <p>
 * Variables are encoded as bare numbers, so decoded variable {@code n} is named {@code Xn}, declared in the file the
 * caller names.
 */
public final class Unquoter {
    private Unquoter(final String file) {
        this.file = file;
    }

    /**
     * The file decoded names are declared in when the caller doesn't name one.
     */
    public static final String decodedFile = "<decoded>";

    /**
     * Decodes the given tree as a program declared in {@code file}, or returns {@code null} if it doesn't encode one.
     */
    public static @Nullable Program program(final Tree tree, final String file) {
        final var unquoter = new Unquoter(file);
        final var fields = Trees.asListOfSize(tree, 3);
        if (fields == null) {
            return null;
        }
        final var read = unquoter.variable(fields.get(0));
        final var block = unquoter.block(fields.get(1));
        final var write = unquoter.variable(fields.get(2));
        if (read == null || block == null || write == null) {
            return null;
        }
        return new Program(file, read, block, write);
    }

    /**
     * Decodes the given tree as a command whose names are declared in {@code file}, or returns {@code null} if it
     * doesn't encode one.
     */
    public static @Nullable Command command(final Tree tree, final String file) {
        return new Unquoter(file).command(tree);
    }

    /**
     * Decodes the given tree as an expression whose names are declared in {@code file}, or returns {@code null} if it
     * doesn't encode one.
     */
    public static @Nullable Expression expression(final Tree tree, final String file) {
        return new Unquoter(file).expression(tree);
    }

    /**
     * Decodes the given tree as a program and prints it, or returns {@code null} if it doesn't encode one.
     */
    public static @Nullable String programSource(final Tree tree) {
        final var program = program(tree, decodedFile);
        return (program != null) ? Printer.print(program) : null;
    }

    /**
     * Decodes the given tree as a command and prints it, or returns {@code null} if it doesn't encode one.
     */
    public static @Nullable String commandSource(final Tree tree) {
        final var command = command(tree, decodedFile);
        return (command != null) ? Printer.print(command) : null;
    }

    /**
     * Decodes the given tree as an expression and prints it, or returns {@code null} if it doesn't encode one.
     */
    public static @Nullable String expressionSource(final Tree tree) {
        final var expression = expression(tree, decodedFile);
        return (expression != null) ? Printer.print(expression) : null;
    }

    private @Nullable List<Command> block(final Tree tree) {
        final var elements = Trees.asList(tree);
        final var commands = new ArrayList<Command>(elements.size());
        for (final var element : elements) {
            final var command = command(element);
            if (command == null) {
                return null;
            }
            commands.add(command);
        }
        return commands;
    }

    private @Nullable Command command(final Tree tree) {
        final var fields = Trees.asList(tree);
        if (fields.isEmpty()) {
            return null;
        }
        final var atom = Atom.byTree(fields.get(0));
        if (atom == null) {
            return null;
        }
        return switch (atom) {
            case ASSIGN -> assign(fields);
            case WHILE -> loop(fields);
            case IF -> conditional(fields);
            default -> null;
        };
    }

    private @Nullable Command assign(final List<Tree> fields) {
        if (fields.size() != 3) {
            return null;
        }
        final var variable = variable(fields.get(1));
        final var value = expression(fields.get(2));
        return (variable != null && value != null) ? new Command.Assign(variable, value) : null;
    }

    private @Nullable Command loop(final List<Tree> fields) {
        if (fields.size() != 3) {
            return null;
        }
        final var guard = expression(fields.get(1));
        final var body = block(fields.get(2));
        return (guard != null && body != null) ? new Command.While(guard, body) : null;
    }

    private @Nullable Command conditional(final List<Tree> fields) {
        if (fields.size() != 4) {
            return null;
        }
        final var guard = expression(fields.get(1));
        final var trueBlock = block(fields.get(2));
        final var falseBlock = block(fields.get(3));
        if (guard == null || trueBlock == null || falseBlock == null) {
            return null;
        }
        return new Command.IfElse(guard, trueBlock, falseBlock);
    }

    private @Nullable Expression expression(final Tree tree) {
        final var fields = Trees.asList(tree);
        if (fields.isEmpty()) {
            return null;
        }
        final var atom = Atom.byTree(fields.get(0));
        if (atom == null) {
            return null;
        }
        return switch (atom) {
            case VAR -> (fields.size() == 2) ? variableExpression(fields.get(1)) : null;
            case QUOTE -> (fields.size() == 2) ? new Expression.Literal(fields.get(1)) : null;
            case HEAD -> (fields.size() == 2) ? unary(fields.get(1), Expression.Head::new) : null;
            case TAIL -> (fields.size() == 2) ? unary(fields.get(1), Expression.Tail::new) : null;
            case CONS -> (fields.size() == 3) ? cons(fields.get(1), fields.get(2)) : null;
            default -> null;
        };
    }

    private @Nullable Expression variableExpression(final Tree tree) {
        final var name = variable(tree);
        return (name != null) ? new Expression.Var(name) : null;
    }

    private @Nullable Expression unary(final Tree tree, final UnaryConstructor constructor) {
        final var operand = expression(tree);
        return (operand != null) ? constructor.construct(operand) : null;
    }

    private @Nullable Expression cons(final Tree headTree, final Tree tailTree) {
        final var head = expression(headTree);
        final var tail = expression(tailTree);
        return (head != null && tail != null) ? new Expression.Cons(head, tail) : null;
    }

    private @Nullable Name variable(final Tree tree) {
        final var number = Trees.asNatural(tree);
        return (number != null) ? new Name(file, "X" + number) : null;
    }

    private final String file;

    @FunctionalInterface
    private interface UnaryConstructor {
        Expression construct(Expression operand);
    }
}
