// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.test;

import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;
import whiletree.sugar.CyclicMacroGraphCondition;
import whiletree.sugar.MacroGraph;
import whiletree.sugar.SugaredCommand;
import whiletree.sugar.SugaredProgram;
import whiletree.sugar.UnknownMacroCondition;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class MacroGraphTest {
    @Test
    void selfRecursionIsRejected() {
        final var universe = universe(caller("a", "a"));
        assertThat(MacroGraph.isAcyclic(universe)).isFalse();
        final var captured = ConditionCapture.captureFatal(() -> MacroGraph.build(universe.get("a"), universe));
        assertThat(captured.condition()).isInstanceOfSatisfying(
            CyclicMacroGraphCondition.class,
            condition -> assertThat(condition.cycle()).containsExactly("a", "a")
        );
        assertThat(captured.traces()).containsExactly("Checking the macro calls reachable from a");
    }

    @Test
    void mutualRecursionIsRejected() {
        final var universe = universe(caller("a", "b"), caller("b", "c"), caller("c", "a"));
        assertThat(MacroGraph.isAcyclic(universe)).isFalse();
        final var captured = ConditionCapture.captureFatal(() -> MacroGraph.build(universe.get("a"), universe));
        assertThat(captured.condition()).isInstanceOfSatisfying(
            CyclicMacroGraphCondition.class,
            condition -> assertThat(condition.cycle()).containsExactly("a", "b", "c", "a")
        );
    }

    @Test
    void cyclesBelowTheRootAreReportedFromWhereTheyStart() {
        final var universe = universe(caller("root", "b"), caller("b", "c"), caller("c", "b"));
        final var captured = ConditionCapture.captureFatal(() -> MacroGraph.build(universe.get("root"), universe));
        assertThat(captured.condition()).isInstanceOfSatisfying(
            CyclicMacroGraphCondition.class,
            condition -> assertThat(condition.cycle()).containsExactly("b", "c", "b")
        );
    }

    @Test
    void sharedDependenciesAreAccepted() {
        final var universe = universe(caller("a", "b", "c"), caller("b", "d"), caller("c", "d"), caller("d"));
        assertThat(MacroGraph.isAcyclic(universe)).isTrue();
        final var graph = MacroGraph.build(universe.get("a"), universe);
        assertThat(graph.programs()).containsOnlyKeys("a", "b", "c", "d");
        assertThat(graph.edges().keySet()).containsExactly("a", "b", "d", "c");
        assertThat(graph.edges().get("a")).containsExactly("b", "c");
        assertThat(graph.edges().get("d")).isEmpty();
        assertThat(graph.program("d")).isSameAs(universe.get("d"));
    }

    @Test
    void onlyReachableProgramsAreCollected() {
        final var universe = universe(caller("root", "leaf"), caller("leaf"), caller("x", "y"), caller("y", "x"));
        assertThat(MacroGraph.isAcyclic(universe)).isFalse();
        final var graph = MacroGraph.build(universe.get("root"), universe);
        assertThat(graph.programs()).containsOnlyKeys("root", "leaf");
        assertThat(graph.program("x")).isNull();
    }

    @Test
    void rootNeedNotBeInTheUniverse() {
        final var leaf = caller("leaf");
        final var graph = MacroGraph.build(caller("root", "leaf"), Map.of("leaf", leaf));
        assertThat(graph.programs()).containsOnlyKeys("root", "leaf");
    }

    @Test
    void unknownMacrosAreRejected() {
        final var universe = universe(caller("a", "b"), caller("b", "missing"));
        final var captured = ConditionCapture.captureFatal(() -> MacroGraph.build(universe.get("a"), universe));
        assertThat(captured.condition()).isInstanceOfSatisfying(
            UnknownMacroCondition.class,
            condition -> assertThat(condition.file()).isEqualTo("missing")
        );
        assertThat(captured.condition().message()).contains("b", "missing");
    }

    @Test
    void acyclicityCheckTreatsUnknownMacrosAsLeaves() {
        final var universe = universe(caller("a", "missing", "b"), caller("b", "missing"));
        assertThat(MacroGraph.isAcyclic(universe)).isTrue();
    }

    private static SugaredProgram caller(final String file, final String... targets) {
        final var read = new Name(file, "X");
        final var result = new Name(file, "Y");
        final var calls = new ArrayList<SugaredCommand>();
        for (final var target : targets) {
            calls.add(new SugaredCommand.MacroCall(result, target, Expression.var(read)));
        }
        final var body = SugaredCommand.sequence(calls.toArray(new SugaredCommand[0]));
        return new SugaredProgram(file, read, body, Expression.var(result));
    }

    private static Map<String, SugaredProgram> universe(final SugaredProgram... programs) {
        final var universe = new TreeMap<String, SugaredProgram>();
        for (final var program : programs) {
            universe.put(program.file(), program);
        }
        return universe;
    }
}
