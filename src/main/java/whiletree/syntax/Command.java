// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.syntax;

import java.util.List;

/**
 * The base interface for core commands. Commands are immutable; blocks are unmodifiable lists.
 */
public sealed interface Command {
    /**
     * Assignment, {@code variable := value}.
     */
    record Assign(Name variable, Expression value) implements Command {
    }

    /**
     * A while loop, running {@code body} as long as {@code guard} isn't nil.
     */
    record While(Expression guard, List<Command> body) implements Command {
        public While {
            body = List.copyOf(body);
        }
    }

    /**
     * A conditional.
     * <p>
     * Exists to host decoded and printed structures; desugaring never produces it.
     */
    record IfElse(Expression guard, List<Command> trueBlock, List<Command> falseBlock) implements Command {
        public IfElse {
            trueBlock = List.copyOf(trueBlock);
            falseBlock = List.copyOf(falseBlock);
        }
    }
}
