// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.sugar;

import java.util.List;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;

/**
 * The base interface for sugared commands: the core commands plus conditionals, switches and macro calls, as a parser
 * produces them. Sugared commands are immutable.
 */
public sealed interface SugaredCommand {
    /**
     * Returns the sequential composition of the given commands, or {@link Skip} if there are none.
     */
    static SugaredCommand sequence(final SugaredCommand... commands) {
        if (commands.length == 0) {
            return new Skip();
        }
        var result = commands[commands.length - 1];
        for (int i = commands.length - 2; i >= 0; i -= 1) {
            result = new Sequence(commands[i], result);
        }
        return result;
    }

    /**
     * The empty command, as written {@code {}}.
     */
    record Skip() implements SugaredCommand {
    }

    /**
     * Runs {@code first}, then {@code second}.
     */
    record Sequence(SugaredCommand first, SugaredCommand second) implements SugaredCommand {
    }

    /**
     * Assignment, {@code variable := value}.
     */
    record Assign(Name variable, Expression value) implements SugaredCommand {
    }

    /**
     * A while loop, running {@code body} as long as {@code guard} isn't nil.
     */
    record While(Expression guard, SugaredCommand body) implements SugaredCommand {
    }

    /**
     * A conditional, running {@code trueBranch} if {@code guard} isn't nil and {@code falseBranch} otherwise.
     */
    record IfElse(Expression guard, SugaredCommand trueBranch, SugaredCommand falseBranch) implements SugaredCommand {
    }

    /**
     * A macro call, {@code target := <file> argument}: runs the program declared in {@code file} on the value of
     * {@code argument} and binds its output to {@code target}.
     */
    record MacroCall(Name target, String file, Expression argument) implements SugaredCommand {
    }

    /**
     * A switch: runs the command of the first case whose expression equals the scrutinee, or the default command if
     * there is none.
     */
    record Switch(Expression scrutinee, List<Case> cases, SugaredCommand defaultCommand) implements SugaredCommand {
        public Switch {
            cases = List.copyOf(cases);
        }
    }

    /**
     * A single arm of a {@link Switch}.
     */
    record Case(Expression match, SugaredCommand command) {
    }
}
