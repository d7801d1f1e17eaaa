// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.test;

import java.util.stream.LongStream;
import whiletree.encoding.Atom;
import whiletree.encoding.RenderMode;
import whiletree.encoding.TreeRenderer;
import whiletree.tree.Tree;
import whiletree.tree.Trees;
import whiletree.tree.reader.ReadErrorCondition;
import whiletree.tree.reader.TreeReader;
import whiletree.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class TreeReaderTest {
    static LongStream provideSeeds() {
        return RandomUtils.provideSeeds();
    }

    @Test
    void readsEveryNotation() {
        assertThat(TreeReader.read("nil")).isEqualTo(Tree.nil());
        assertThat(TreeReader.read("  <nil . nil>\n")).isEqualTo(Trees.TRUE);
        assertThat(TreeReader.read("3")).isEqualTo(Trees.fromNatural(3));
        assertThat(TreeReader.read("[]")).isEqualTo(Tree.nil());
        assertThat(TreeReader.read("[1, 2]")).isEqualTo(Trees.listOf(Trees.TRUE, Trees.fromNatural(2)));
        assertThat(TreeReader.read("@while")).isEqualTo(Atom.WHILE.tree());
        assertThat(TreeReader.read("<<nil.nil>.<nil.nil>>")).isEqualTo(Tree.cons(Trees.TRUE, Trees.TRUE));
    }

    @Test
    void readsAtomTaggedPrograms() {
        final var tree = TreeReader.read("[@asgn, 0, [@hd, [@var, 0]]]");
        final var expected = Trees.listOf(
            Atom.ASSIGN.tree(),
            Tree.nil(),
            Trees.listOf(Atom.HEAD.tree(), Trees.listOf(Atom.VAR.tree(), Tree.nil()))
        );
        assertThat(tree).isEqualTo(expected);
    }

    @Test
    void readsSeveralTopLevelForms() {
        final var reader = new TreeReader("1 [2]\n nil");
        assertThat(reader.readTopLevelForm()).isEqualTo(Trees.TRUE);
        assertThat(reader.readTopLevelForm()).isEqualTo(Trees.listOf(Trees.fromNatural(2)));
        assertThat(reader.readTopLevelForm()).isEqualTo(Tree.nil());
        assertThat(reader.readTopLevelForm()).isNull();
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void readingRenderedTreesYieldsTheTree(final long seed) {
        final var generator = RandomUtils.createGenerator(seed);
        for (int i = 0; i < 100; i += 1) {
            final var tree = RandomUtils.generateTree(generator, generator.nextInt(40));
            for (final var mode : RenderMode.values()) {
                final var text = TreeRenderer.render(tree, mode);
                assertThat(TreeReader.read(text)).as("seed %d, %s: %s", seed, mode, text).isEqualTo(tree);
            }
        }
    }

    @Test
    void longDottedSpinesDontCountAsNesting() {
        final var tree = Trees.fromNatural(5_000);
        assertThat(TreeReader.read(tree.toString())).isEqualTo(tree);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "<nil nil>", "<nil.nil", "nil nil", "[1, 2", "[1 2]", "@bogus", "nul", "#", "]"})
    void malformedInputIsAReadError(final String text) {
        assertThatThrownBy(() -> TreeReader.read(text))
            .isInstanceOfSatisfying(
                UnhandledErrorError.class,
                error -> assertThat(error.condition()).isInstanceOf(ReadErrorCondition.class)
            );
    }

    @Test
    void readErrorsCarryTheColumn() {
        final var captured = ConditionCapture.captureFatal(() -> TreeReader.read("<nil nil>"));
        assertThat(captured.condition()).isInstanceOfSatisfying(
            ReadErrorCondition.class,
            condition -> assertThat(condition.column()).isEqualTo(6)
        );
    }

    @Test
    void excessiveNestingIsRejected() {
        final var text = "[".repeat(2_000) + "]".repeat(2_000);
        final var captured = ConditionCapture.captureFatal(() -> TreeReader.read(text));
        assertThat(captured.condition().message()).contains("Nesting limit");
    }

    @Test
    void hugeNaturalsAreAReadErrorRatherThanAnAllocation() {
        final var captured = ConditionCapture.captureFatal(() -> TreeReader.read("2000000000"));
        assertThat(captured.condition()).isInstanceOf(ReadErrorCondition.class);
        assertThat(captured.condition().message()).contains("too large").contains("1000000");
        assertThat(TreeReader.read("1000000")).isEqualTo(Trees.fromNatural(1_000_000));
    }
}
