// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a fatal condition was signaled with {@link ConditionContext#error(Condition)} and no handler unwound.
 * <p>
 * The condition stays reachable through {@link #condition()}, so callers without handlers still learn what went wrong.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the condition nobody handled.
     */
    public @NotNull Condition condition() {
        return condition;
    }

    private final transient @NotNull Condition condition;
}
