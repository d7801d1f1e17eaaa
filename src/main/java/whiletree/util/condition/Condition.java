// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type for all conditions signaled by the toolchain.
 * <p>
 * A condition describes something that went wrong with the <em>input</em> of an operation: a cyclic macro graph,
 * a malformed tree literal, a program the tree encoding cannot express. Handlers run <em>before</em> the stack is
 * unwound, so a handler can inspect the active {@link whiletree.util.Trace} messages describing what was being compiled
 * when the problem was found, and then pick a {@link Restart}.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the user-readable message representing this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves the full, user-readable message, including any context specific to the condition type.
     * <p>
     * Defaults to {@link #message()}.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + ": " + message;
    }

    private final @NotNull String message;
}
