// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.util;

import org.jetbrains.annotations.NotNull;

/**
 * Facilities for bypassing the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as an <em>unchecked exception</em>, no matter its static nor dynamic type.
     * <p>
     * Reserved for {@link whiletree.util.condition.Unwind}, which passes through every frame between a handler and
     * its restart point, none of which should have to declare it.
     * <p>
     * Since this method never returns normally, it's declared to return {@link UnreachableCodeReachedError} that can
     * be "thrown" at call sites to help the compiler's control flow analysis.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast doesn't exist in bytecode; absent other constraints the compiler infers E
    // as RuntimeException at the call site above.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
