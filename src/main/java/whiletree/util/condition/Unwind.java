// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Throwable type used by the restart mechanism for transferring control flow to a given restart point.
 * <p>
 * Exposed so that functions can be marked as throwing {@code Unwind}; user code should neither throw nor catch it.
 * It extends {@link Throwable} directly, as it is neither a recoverable {@link Exception} nor a fatal {@link Error}.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    // Unwinds are never serialized.
    private final transient @NotNull Restart target;
}
