// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.test;

import whiletree.encoding.Quoter;
import whiletree.encoding.RenderMode;
import whiletree.encoding.TreeRenderer;
import whiletree.syntax.Command;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;
import whiletree.tree.Tree;
import whiletree.tree.Trees;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

final class TreeRendererTest {
    @ParameterizedTest
    @EnumSource(RenderMode.class)
    void naturalsRenderAsDecimalInEveryMode(final RenderMode mode) {
        assertThat(TreeRenderer.render(Tree.nil(), mode)).isEqualTo("0");
        assertThat(TreeRenderer.render(Trees.fromNatural(3), mode)).isEqualTo("3");
        assertThat(TreeRenderer.render(Trees.fromNatural(41), mode)).isEqualTo("41");
    }

    @Test
    void rawModeUsesDottedNotation() {
        final var tree = Tree.cons(Trees.TRUE, Trees.fromNatural(2));
        assertThat(TreeRenderer.render(tree, RenderMode.RAW)).isEqualTo("<<nil.nil>.<nil.<nil.nil>>>");
    }

    @Test
    void nestedListModeRendersElementsRecursively() {
        final var tree = Trees.listOf(Trees.fromNatural(2), Tree.nil(), Trees.listOf(Trees.TRUE, Trees.TRUE));
        assertThat(TreeRenderer.render(tree, RenderMode.NESTED_LIST)).isEqualTo("[2, 0, [1, 1]]");
    }

    @Test
    void atomTaggedModeTagsOnlyTheFirstElement() {
        final var x = new Name("main.while", "X");
        final var command = new Command.Assign(x, new Expression.Head(Expression.var(x)));
        final var quoted = Quoter.quote(command);
        assertThat(TreeRenderer.render(quoted, RenderMode.NESTED_LIST)).isEqualTo("[2, 0, [23, [17, 0]]]");
        assertThat(TreeRenderer.render(quoted, RenderMode.ATOM_TAGGED)).isEqualTo("[@asgn, 0, [@hd, [@var, 0]]]");

        final var quotedAtom = Trees.listOf(Trees.fromNatural(19), Trees.fromNatural(5));
        assertThat(TreeRenderer.atomTagged(quotedAtom)).isEqualTo("[@quote, 5]");
    }

    @Test
    void atomTaggedModeLeavesOtherFirstElementsAlone() {
        final var tree = Trees.listOf(Trees.fromNatural(4), Trees.TRUE);
        assertThat(TreeRenderer.atomTagged(tree)).isEqualTo("[4, 1]");
        final var nested = Trees.listOf(Trees.listOf(Trees.fromNatural(5), Trees.TRUE), Trees.fromNatural(5));
        assertThat(TreeRenderer.atomTagged(nested)).isEqualTo("[[@while, 1], 5]");
    }

    @Test
    void integerModeFallsBackToDottedOrE() {
        final var notANatural = Tree.cons(Trees.TRUE, Tree.nil());
        assertThat(TreeRenderer.integer(Trees.fromNatural(7), false)).isEqualTo("7");
        assertThat(TreeRenderer.integer(notANatural, true)).isEqualTo("<<nil.nil>.nil>");
        assertThat(TreeRenderer.integer(notANatural, false)).isEqualTo("E");
    }

    @Test
    void integerListModeRendersEachElementAsAnInteger() {
        final var tree = Trees.listOf(Trees.fromNatural(1), Trees.fromNatural(2), Tree.cons(Trees.TRUE, Tree.nil()));
        assertThat(TreeRenderer.integerList(tree, false)).isEqualTo("[1, 2, E]");
        assertThat(TreeRenderer.integerList(tree, true)).isEqualTo("[1, 2, <<nil.nil>.nil>]");
        assertThat(TreeRenderer.integerList(Tree.nil(), false)).isEqualTo("[]");
    }
}
