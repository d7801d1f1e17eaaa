// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.test;

import java.util.List;
import whiletree.encoding.Unquoter;
import whiletree.eval.Evaluator;
import whiletree.eval.StepLimitExceededCondition;
import whiletree.syntax.Command;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;
import whiletree.syntax.Program;
import whiletree.tree.Tree;
import whiletree.tree.Trees;
import whiletree.tree.reader.TreeReader;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import org.junit.jupiter.api.Test;

final class EvaluatorTest {
    @Test
    void reversesLists() {
        final var execution = Evaluator.unlimited().run(reverse(), TreeReader.read("[1, 2, 3]"));
        assertThat(execution.output()).isEqualTo(TreeReader.read("[3, 2, 1]"));
        assertThat(execution.steps()).isEqualTo(3);
        assertThat(execution.valueOf(x).isNil()).isTrue();
    }

    @Test
    void stepLimitStopsRunawayPrograms() {
        final var program = new Program(file, x, List.of(
            new Command.While(new Expression.Literal(Trees.TRUE), List.of())
        ), x);
        final var captured = ConditionCapture.captureFatal(() -> Evaluator.withStepLimit(10).run(program, Tree.nil()));
        assertThat(captured.condition()).isInstanceOf(StepLimitExceededCondition.class);
        assertThat(captured.condition().message()).contains("10");
        assertThat(captured.traces()).containsExactly("Running program " + file);
    }

    @Test
    void stepLimitIsInclusive() {
        final var execution = Evaluator.withStepLimit(3).run(reverse(), TreeReader.read("[1, 2, 3]"));
        assertThat(execution.steps()).isEqualTo(3);
    }

    @Test
    void negativeStepLimitsAreRejected() {
        assertThatIllegalArgumentException().isThrownBy(() -> Evaluator.withStepLimit(-1));
    }

    @Test
    void projectionsOfNilAreNil() {
        final var program = new Program(file, x, List.of(
            new Command.Assign(y, new Expression.Cons(
                new Expression.Head(Expression.var(x)),
                new Expression.Tail(new Expression.Tail(Expression.var(x)))
            ))
        ), y);
        final var output = Evaluator.unlimited().run(program, Tree.nil()).output();
        assertThat(output).isEqualTo(Tree.cons(Tree.nil(), Tree.nil()));
    }

    @Test
    void equalityYieldsTrueOrNil() {
        final var program = new Program(file, x, List.of(
            new Command.Assign(y, new Expression.IsEqual(Expression.var(x), new Expression.Literal(Trees.TRUE)))
        ), y);
        assertThat(Evaluator.unlimited().run(program, Trees.TRUE).output()).isEqualTo(Trees.TRUE);
        assertThat(Evaluator.unlimited().run(program, Trees.fromNatural(3)).output()).isEqualTo(Tree.nil());
    }

    @Test
    void runsDecodedConditionals() {
        final var program = Unquoter.program(
            TreeReader.read("[0, [[@if, [@var, 0], [[@asgn, 1, [@quote, 5]]], [[@asgn, 1, [@quote, 9]]]]], 1]"),
            file
        );
        assertThat(program).isNotNull();
        assertThat(Evaluator.unlimited().run(program, Trees.TRUE).output()).isEqualTo(Trees.fromNatural(5));
        assertThat(Evaluator.unlimited().run(program, Tree.nil()).output()).isEqualTo(Trees.fromNatural(9));
    }

    @Test
    void unassignedVariablesAreNil() {
        final var execution = Evaluator.unlimited().run(new Program(file, x, List.of(), y), Trees.TRUE);
        assertThat(execution.output().isNil()).isTrue();
        assertThat(execution.valueOf(x)).isEqualTo(Trees.TRUE);
        assertThat(execution.variables()).containsOnlyKeys(x);
    }

    private static Program reverse() {
        return new Program(file, x, List.of(
            new Command.Assign(y, Expression.nil()),
            new Command.While(Expression.var(x), List.of(
                new Command.Assign(y, new Expression.Cons(new Expression.Head(Expression.var(x)), Expression.var(y))),
                new Command.Assign(x, new Expression.Tail(Expression.var(x)))
            ))
        ), y);
    }

    private static final String file = "eval.while";
    private static final Name x = new Name(file, "X");
    private static final Name y = new Name(file, "Y");
}
