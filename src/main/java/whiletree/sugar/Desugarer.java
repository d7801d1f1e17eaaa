// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.sugar;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import whiletree.syntax.Command;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;
import whiletree.syntax.Program;
import whiletree.tree.Trees;
import whiletree.util.Trace;
import whiletree.util.UnreachableCodeReachedError;

/**
 * The desugarer: turns a {@link SugaredProgram} into an equivalent core {@link Program} made of assignments and
 * while loops only.
 * <p>
 * Macro calls are inlined. Every name carries its file, so a macro's variables never capture the caller's.
 * <p>
 * Conditionals become while loops over two stacks kept in variables no parser accepts as identifiers. Given guard
 * {@code E}, the conditional {@code if E {C1} else {C2}} becomes:
 * <pre>
 * +NOT+EXP+STACK+ := cons &lt;nil.nil&gt; +NOT+EXP+STACK+;
 * +EXP+VAL+STACK+ := cons E +EXP+VAL+STACK+;
 * while hd +EXP+VAL+STACK+ {
 *     +EXP+VAL+STACK+ := cons nil tl +EXP+VAL+STACK+;
 *     +NOT+EXP+STACK+ := cons nil tl +NOT+EXP+STACK+;
 *     C1
 * };
 * while hd +NOT+EXP+STACK+ {
 *     +NOT+EXP+STACK+ := cons nil tl +NOT+EXP+STACK+;
 *     C2
 * };
 * +NOT+EXP+STACK+ := tl +NOT+EXP+STACK+;
 * +EXP+VAL+STACK+ := tl +EXP+VAL+STACK+
 * </pre>
 * Each loop body clears the top of the stack it tests, so each loop runs at most once. Every conditional pushes and
 * pops exactly one frame on each stack, so conditionals nested in {@code C1} or {@code C2} leave the enclosing frame
 * untouched. Switches become nested conditionals on {@code scrutinee = case}, the first case outermost.
 */
public final class Desugarer {
    private Desugarer(final String file, final MacroGraph macros) {
        this.file = file;
        this.macros = macros;
        valueStack = new Name(file, "+EXP+VAL+STACK+");
        notValueStack = new Name(file, "+NOT+EXP+STACK+");
    }

    /**
     * Desugars a program that calls no macros.
     * <p>
     * Signals a fatal {@link UnknownMacroCondition} if it calls one after all.
     */
    public static Program desugar(final SugaredProgram program) {
        return desugar(program, Map.of());
    }

    /**
     * Desugars the given program, inlining the macros it calls from {@code universe}, keyed by file.
     * <p>
     * The macro-call graph is checked before anything is desugared; a cycle or a call to a file missing from
     * {@code universe} signals the fatal conditions described in {@link MacroGraph#build(SugaredProgram, Map)}.
     */
    public static Program desugar(final SugaredProgram program, final Map<String, SugaredProgram> universe) {
        try (final var trace = new Trace(() -> "Desugaring program " + program.file())) {
            trace.use();
            final var macros = MacroGraph.build(program, universe);
            return new Desugarer(program.file(), macros).desugarProgram(program);
        }
    }

    private Program desugarProgram(final SugaredProgram program) {
        final var block = new ArrayList<Command>();
        desugar(program.body(), block);
        final var writeExpression = program.writeExpression();
        final Name writeVariable;
        if (writeExpression instanceof Expression.Var reference && reference.name().file().equals(file)) {
            writeVariable = reference.name();
        } else {
            writeVariable = new Name(file, "+WRITE+");
            block.add(new Command.Assign(writeVariable, writeExpression));
        }
        return new Program(file, program.readVariable(), block, writeVariable);
    }

    private List<Command> desugarBlock(final SugaredCommand command) {
        final var block = new ArrayList<Command>();
        desugar(command, block);
        return block;
    }

    private void desugar(final SugaredCommand command, final List<Command> output) {
        if (command instanceof SugaredCommand.Skip) {
            return;
        } else if (command instanceof SugaredCommand.Sequence sequence) {
            desugar(sequence.first(), output);
            desugar(sequence.second(), output);
        } else if (command instanceof SugaredCommand.Assign assign) {
            output.add(new Command.Assign(assign.variable(), assign.value()));
        } else if (command instanceof SugaredCommand.While loop) {
            output.add(new Command.While(loop.guard(), desugarBlock(loop.body())));
        } else if (command instanceof SugaredCommand.IfElse conditional) {
            final var trueBlock = desugarBlock(conditional.trueBranch());
            final var falseBlock = desugarBlock(conditional.falseBranch());
            translateConditional(conditional.guard(), trueBlock, falseBlock, output);
        } else if (command instanceof SugaredCommand.MacroCall call) {
            expandMacro(call, output);
        } else if (command instanceof SugaredCommand.Switch switchCommand) {
            translateSwitch(switchCommand, 0, output);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void expandMacro(final SugaredCommand.MacroCall call, final List<Command> output) {
        final var macro = macros.program(call.file());
        if (macro == null) {
            throw new UnreachableCodeReachedError("Macro " + call.file() + " missing from the macro graph");
        }
        try (final var trace = new Trace(() -> "Expanding macro " + call.file() + " into " + call.target())) {
            trace.use();
            output.add(new Command.Assign(macro.readVariable(), call.argument()));
            desugar(macro.body(), output);
            output.add(new Command.Assign(call.target(), macro.writeExpression()));
        }
    }

    private void translateSwitch(
        final SugaredCommand.Switch switchCommand,
        final int caseIndex,
        final List<Command> output
    ) {
        final var cases = switchCommand.cases();
        if (caseIndex == cases.size()) {
            desugar(switchCommand.defaultCommand(), output);
            return;
        }
        final var switchCase = cases.get(caseIndex);
        final var guard = new Expression.IsEqual(switchCommand.scrutinee(), switchCase.match());
        final var trueBlock = desugarBlock(switchCase.command());
        final var falseBlock = new ArrayList<Command>();
        translateSwitch(switchCommand, caseIndex + 1, falseBlock);
        translateConditional(guard, trueBlock, falseBlock, output);
    }

    private void translateConditional(
        final Expression guard,
        final List<Command> trueBlock,
        final List<Command> falseBlock,
        final List<Command> output
    ) {
        output.add(push(notValueStack, new Expression.Literal(Trees.TRUE)));
        output.add(push(valueStack, guard));

        final var trueBody = new ArrayList<Command>();
        trueBody.add(clearTop(valueStack));
        trueBody.add(clearTop(notValueStack));
        trueBody.addAll(trueBlock);
        output.add(new Command.While(top(valueStack), trueBody));

        final var falseBody = new ArrayList<Command>();
        falseBody.add(clearTop(notValueStack));
        falseBody.addAll(falseBlock);
        output.add(new Command.While(top(notValueStack), falseBody));

        output.add(pop(notValueStack));
        output.add(pop(valueStack));
    }

    private static Command push(final Name stack, final Expression value) {
        return new Command.Assign(stack, new Expression.Cons(value, Expression.var(stack)));
    }

    private static Command clearTop(final Name stack) {
        final var rest = new Expression.Tail(Expression.var(stack));
        return new Command.Assign(stack, new Expression.Cons(Expression.nil(), rest));
    }

    private static Command pop(final Name stack) {
        return new Command.Assign(stack, new Expression.Tail(Expression.var(stack)));
    }

    private static Expression top(final Name stack) {
        return new Expression.Head(Expression.var(stack));
    }

    private final String file;
    private final MacroGraph macros;
    private final Name valueStack;
    private final Name notValueStack;
}
