// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.util;

import org.jetbrains.annotations.NotNull;

/**
 * Error type signifying that control flow reached a point that should be unreachable: a syntax variant missing from
 * an exhaustive dispatch, or an internal table that should have been populated but wasn't.
 * <p>
 * Since this represents a programming error, this class extends {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
