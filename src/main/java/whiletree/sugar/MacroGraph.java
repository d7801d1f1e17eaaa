// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.sugar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import whiletree.util.Trace;
import whiletree.util.UnreachableCodeReachedError;
import whiletree.util.annotation.Nullable;
import whiletree.util.condition.ConditionContext;

/**
 * The macro-call graph reachable from a program: programs are nodes, and each program has an edge to every file it
 * calls as a macro.
 * <p>
 * Macro calls are expanded by inlining, so the graph must be acyclic for desugaring to terminate. The graph is
 * explored with an explicit worklist instead of recursion, recording the outgoing edges of every program visited.
 * A program reached again while it is still on the current path closes a cycle; a program reached again after it has
 * been fully explored is merely shared, as in a diamond.
 */
public final class MacroGraph {
    private MacroGraph(final Map<String, SugaredProgram> programs, final Map<String, SortedSet<String>> edges) {
        this.programs = programs;
        this.edges = edges;
    }

    /**
     * Collects the given program and every program it transitively calls as a macro from {@code universe}.
     * <p>
     * On error, a fatal condition is signaled:
     * <ul>
     * <li>{@link UnknownMacroCondition} if a reachable program calls a file that isn't in {@code universe};
     * <li>{@link CyclicMacroGraphCondition} if the reachable programs call each other in a cycle, including a program
     * calling itself.
     * </ul>
     */
    public static MacroGraph build(final SugaredProgram root, final Map<String, SugaredProgram> universe) {
        try (final var trace = new Trace(() -> "Checking the macro calls reachable from " + root.file())) {
            trace.use();
            final var known = new HashMap<>(universe);
            known.put(root.file(), root);
            final var traversal = new Traversal(known, true);
            final var cycle = traversal.findCycleFrom(root.file());
            if (cycle != null) {
                throw ConditionContext.error(new CyclicMacroGraphCondition(cycle));
            }
            final var programs = new TreeMap<String, SugaredProgram>();
            for (final var file : traversal.edges.keySet()) {
                programs.put(file, known.get(file));
            }
            return new MacroGraph(
                Collections.unmodifiableMap(programs),
                Collections.unmodifiableMap(traversal.edges)
            );
        }
    }

    /**
     * Returns {@code true} iff no program in {@code universe} can reach itself through macro calls.
     * <p>
     * Calls to files outside {@code universe} are treated as calls to programs that call nothing.
     */
    public static boolean isAcyclic(final Map<String, SugaredProgram> universe) {
        final var traversal = new Traversal(universe, false);
        for (final var file : new TreeSet<>(universe.keySet())) {
            if (traversal.findCycleFrom(file) != null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the program declared in the given file if it is part of this graph, or {@code null} otherwise.
     */
    public @Nullable SugaredProgram program(final String file) {
        return programs.get(file);
    }

    /**
     * Retrieves every program in this graph, keyed by file.
     */
    public Map<String, SugaredProgram> programs() {
        return programs;
    }

    /**
     * Retrieves the outgoing edges of every program in this graph, in the order the programs were visited.
     */
    public Map<String, SortedSet<String>> edges() {
        return edges;
    }

    private final Map<String, SugaredProgram> programs;
    private final Map<String, SortedSet<String>> edges;

    private static final class Traversal {
        private Traversal(final Map<String, SugaredProgram> universe, final boolean requireKnownTargets) {
            this.universe = universe;
            this.requireKnownTargets = requireKnownTargets;
        }

        private @Nullable List<String> findCycleFrom(final String start) {
            if (finished.contains(start)) {
                return null;
            }
            visit(start);
            while (!path.isEmpty()) {
                final var frame = path.peekLast();
                if (!frame.children.hasNext()) {
                    finished.add(frame.file);
                    path.removeLast();
                    continue;
                }
                final var child = frame.children.next();
                if (finished.contains(child)) {
                    continue;
                }
                if (edges.containsKey(child)) {
                    return cycleEndingAt(child);
                }
                if (!universe.containsKey(child)) {
                    if (requireKnownTargets) {
                        throw ConditionContext.error(new UnknownMacroCondition(frame.file, child));
                    }
                    edges.put(child, Collections.emptySortedSet());
                    finished.add(child);
                    continue;
                }
                visit(child);
            }
            return null;
        }

        private void visit(final String file) {
            final var program = universe.get(file);
            if (program == null) {
                throw new UnreachableCodeReachedError("Visiting program " + file + " outside the macro universe");
            }
            final var children = program.macroTargets();
            edges.put(file, children);
            path.addLast(new Frame(file, children.iterator()));
        }

        private List<String> cycleEndingAt(final String file) {
            final var cycle = new ArrayList<String>();
            var onCycle = false;
            for (final var frame : path) {
                onCycle = onCycle || frame.file.equals(file);
                if (onCycle) {
                    cycle.add(frame.file);
                }
            }
            cycle.add(file);
            return cycle;
        }

        private final Map<String, SugaredProgram> universe;
        private final boolean requireKnownTargets;
        private final LinkedHashMap<String, SortedSet<String>> edges = new LinkedHashMap<>();
        private final TreeSet<String> finished = new TreeSet<>();
        private final ArrayDeque<Frame> path = new ArrayDeque<>();
    }

    private record Frame(String file, Iterator<String> children) {
    }
}
