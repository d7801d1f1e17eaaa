// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.sugar;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;
import whiletree.util.UnreachableCodeReachedError;

/**
 * A sugared While program, {@code name read readVariable { body } write writeExpression}.
 * <p>
 * The program's file is its name: macro calls refer to programs by file.
 *
 * @param file            The file the program was declared in.
 * @param readVariable    The variable bound to the input, or to a macro call's argument.
 * @param body            The program body.
 * @param writeExpression The expression whose value, once the body has run, is the output.
 */
public record SugaredProgram(String file, Name readVariable, SugaredCommand body, Expression writeExpression) {
    public SugaredProgram {
        if (!readVariable.file().equals(file)) {
            throw new IllegalArgumentException(
                "Read variable of " + file + " must be declared in it, got " + readVariable);
        }
    }

    /**
     * Returns the files this program calls as macros directly, in sorted order.
     */
    public SortedSet<String> macroTargets() {
        final var targets = new TreeSet<String>();
        collectMacroTargets(body, targets);
        return Collections.unmodifiableSortedSet(targets);
    }

    private static void collectMacroTargets(final SugaredCommand command, final TreeSet<String> targets) {
        if (command instanceof SugaredCommand.Skip || command instanceof SugaredCommand.Assign) {
            return;
        } else if (command instanceof SugaredCommand.Sequence sequence) {
            collectMacroTargets(sequence.first(), targets);
            collectMacroTargets(sequence.second(), targets);
        } else if (command instanceof SugaredCommand.While loop) {
            collectMacroTargets(loop.body(), targets);
        } else if (command instanceof SugaredCommand.IfElse conditional) {
            collectMacroTargets(conditional.trueBranch(), targets);
            collectMacroTargets(conditional.falseBranch(), targets);
        } else if (command instanceof SugaredCommand.MacroCall call) {
            targets.add(call.file());
        } else if (command instanceof SugaredCommand.Switch switchCommand) {
            for (final var switchCase : switchCommand.cases()) {
                collectMacroTargets(switchCase.command(), targets);
            }
            collectMacroTargets(switchCommand.defaultCommand(), targets);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }
}
