// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.eval;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import whiletree.syntax.Command;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;
import whiletree.syntax.Program;
import whiletree.tree.Tree;
import whiletree.tree.Trees;
import whiletree.util.Trace;
import whiletree.util.UnreachableCodeReachedError;
import whiletree.util.condition.ConditionContext;

/**
 * A straightforward interpreter for core programs.
 * <p>
 * Every variable starts out as nil, except the read variable, which is bound to the input. {@code hd} and {@code tl}
 * of nil are nil. An equality test yields {@code <nil.nil>} for equal trees and nil otherwise. Loops and conditionals
 * treat nil as false and every other tree as true.
 * <p>
 * An evaluator may be given a limit on the number of loop iterations; a program that exceeds it signals a fatal
 * {@link StepLimitExceededCondition}.
 */
public final class Evaluator {
    private Evaluator(final long stepLimit) {
        this.stepLimit = stepLimit;
    }

    /**
     * Returns an evaluator that runs programs until they finish, however long that takes.
     */
    public static Evaluator unlimited() {
        return new Evaluator(Long.MAX_VALUE);
    }

    /**
     * Returns an evaluator that gives up after {@code stepLimit} loop iterations in total.
     *
     * @throws IllegalArgumentException if {@code stepLimit} is negative.
     */
    public static Evaluator withStepLimit(final long stepLimit) {
        if (stepLimit < 0) {
            throw new IllegalArgumentException("Negative step limit " + stepLimit);
        }
        return new Evaluator(stepLimit);
    }

    /**
     * Runs the given program on the given input.
     */
    public Execution run(final Program program, final Tree input) {
        try (final var trace = new Trace(() -> "Running program " + program.file())) {
            trace.use();
            final var run = new Run();
            run.store.put(program.readVariable(), input);
            run.execute(program.block());
            final var output = run.lookup(program.writeVariable());
            return new Execution(output, Map.copyOf(run.store), run.steps);
        }
    }

    private final long stepLimit;

    /**
     * The outcome of running a program.
     *
     * @param output    The final value of the write variable.
     * @param variables The final value of every variable that was ever assigned.
     * @param steps     The number of loop iterations performed.
     */
    public record Execution(Tree output, Map<Name, Tree> variables, long steps) {
        /**
         * Returns the final value of the given variable, nil if it was never assigned.
         */
        public Tree valueOf(final Name name) {
            final var value = variables.get(name);
            return (value != null) ? value : Tree.nil();
        }
    }

    private final class Run {
        private void execute(final List<Command> block) {
            for (final var command : block) {
                execute(command);
            }
        }

        private void execute(final Command command) {
            if (command instanceof Command.Assign assign) {
                store.put(assign.variable(), evaluate(assign.value()));
            } else if (command instanceof Command.While loop) {
                while (!evaluate(loop.guard()).isNil()) {
                    countStep();
                    execute(loop.body());
                }
            } else if (command instanceof Command.IfElse conditional) {
                if (!evaluate(conditional.guard()).isNil()) {
                    execute(conditional.trueBlock());
                } else {
                    execute(conditional.falseBlock());
                }
            } else {
                throw new UnreachableCodeReachedError();
            }
        }

        private Tree evaluate(final Expression expression) {
            if (expression instanceof Expression.Var reference) {
                return lookup(reference.name());
            } else if (expression instanceof Expression.Literal literal) {
                return literal.value();
            } else if (expression instanceof Expression.Cons cons) {
                final var head = evaluate(cons.head());
                return Tree.cons(head, evaluate(cons.tail()));
            } else if (expression instanceof Expression.Head head) {
                return evaluate(head.operand()).head();
            } else if (expression instanceof Expression.Tail tail) {
                return evaluate(tail.operand()).tail();
            } else if (expression instanceof Expression.IsEqual isEqual) {
                final var left = evaluate(isEqual.left());
                return Trees.fromBoolean(left.equals(evaluate(isEqual.right())));
            } else {
                throw new UnreachableCodeReachedError();
            }
        }

        private Tree lookup(final Name name) {
            final var value = store.get(name);
            return (value != null) ? value : Tree.nil();
        }

        private void countStep() {
            if (steps == stepLimit) {
                throw ConditionContext.error(new StepLimitExceededCondition(stepLimit));
            }
            steps += 1;
        }

        private final HashMap<Name, Tree> store = new HashMap<>();
        private long steps = 0;
    }
}
