// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * A functional interface representing {@link Handler} procedures.
 * <p>
 * A procedure declines a condition by returning normally. It handles one by transferring control elsewhere, usually
 * with {@link Restart#unwindTo()}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    void handle(@NotNull SignaledCondition condition) throws Unwind;
}
