// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.syntax;

import java.util.List;
import whiletree.util.UnreachableCodeReachedError;
import whiletree.util.annotation.Nullable;

/**
 * Prints core syntax in the usual block/while/if surface form, for diagnostics and decoded programs.
 * <p>
 * Blocks are indented by four spaces per level and commands are separated by semicolons:
 * <pre>
 * read X {
 *     Y := (cons X nil);
 *     while X {
 *         X := tl X
 *     }
 * } write Y
 * </pre>
 * Names declared in the file being printed appear bare; names from other files, such as those of inlined macros, are
 * printed as {@code text@file}.
 */
public final class Printer {
    private Printer(final @Nullable String homeFile) {
        this.homeFile = homeFile;
    }

    /**
     * Prints the given program.
     */
    public static String print(final Program program) {
        final var printer = new Printer(program.file());
        printer.builder.append("read ");
        printer.append(program.readVariable());
        printer.builder.append(' ');
        printer.appendBlock(program.block(), 0);
        printer.builder.append(" write ");
        printer.append(program.writeVariable());
        return printer.builder.toString();
    }

    /**
     * Prints the given command at indentation level zero, with every name bare.
     */
    public static String print(final Command command) {
        return print(command, 0);
    }

    /**
     * Prints the given command at the given indentation level, with every name bare.
     *
     * @throws IllegalArgumentException if {@code depth} is negative.
     */
    public static String print(final Command command, final int depth) {
        final var printer = new Printer(null);
        printer.append(command, depth);
        return printer.builder.toString();
    }

    /**
     * Prints the given expression, with every name bare.
     */
    public static String print(final Expression expression) {
        final var printer = new Printer(null);
        printer.append(expression);
        return printer.builder.toString();
    }

    /**
     * Returns the indentation for the given nesting depth: four spaces per level.
     *
     * @throws IllegalArgumentException if {@code depth} is negative.
     */
    public static String indentation(final int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Negative indentation depth " + depth);
        }
        return "    ".repeat(depth);
    }

    private void appendBlock(final List<Command> block, final int depth) {
        if (block.isEmpty()) {
            builder.append("{}");
            return;
        }
        builder.append("{\n");
        var first = true;
        for (final var command : block) {
            if (!first) {
                builder.append(";\n");
            }
            first = false;
            append(command, depth + 1);
        }
        builder.append('\n');
        builder.append(indentation(depth));
        builder.append('}');
    }

    private void append(final Command command, final int depth) {
        builder.append(indentation(depth));
        if (command instanceof Command.Assign assign) {
            append(assign.variable());
            builder.append(" := ");
            append(assign.value());
        } else if (command instanceof Command.While loop) {
            builder.append("while ");
            append(loop.guard());
            builder.append(' ');
            appendBlock(loop.body(), depth);
        } else if (command instanceof Command.IfElse conditional) {
            builder.append("if ");
            append(conditional.guard());
            builder.append(' ');
            appendBlock(conditional.trueBlock(), depth);
            builder.append(" else ");
            appendBlock(conditional.falseBlock(), depth);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void append(final Expression expression) {
        if (expression instanceof Expression.Var reference) {
            append(reference.name());
        } else if (expression instanceof Expression.Literal literal) {
            builder.append(literal.value());
        } else if (expression instanceof Expression.Cons cons) {
            builder.append("(cons ");
            append(cons.head());
            builder.append(' ');
            append(cons.tail());
            builder.append(')');
        } else if (expression instanceof Expression.Head head) {
            builder.append("hd ");
            append(head.operand());
        } else if (expression instanceof Expression.Tail tail) {
            builder.append("tl ");
            append(tail.operand());
        } else if (expression instanceof Expression.IsEqual isEqual) {
            builder.append('(');
            append(isEqual.left());
            builder.append(" = ");
            append(isEqual.right());
            builder.append(')');
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void append(final Name name) {
        builder.append(name.text());
        if (homeFile != null && !homeFile.equals(name.file())) {
            builder.append('@');
            builder.append(name.file());
        }
    }

    private final @Nullable String homeFile;
    private final StringBuilder builder = new StringBuilder();
}
