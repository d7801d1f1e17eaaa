// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.syntax;

import java.util.Comparator;

/**
 * A variable name, qualified by the file that declares it.
 * <p>
 * Two names are equal only if both their file and their text are. A macro's variables therefore never collide with
 * the caller's, even when they're spelled the same.
 *
 * @param file The file (program) declaring the name.
 * @param text The identifier as written.
 */
public record Name(String file, String text) implements Comparable<Name> {
    @Override
    public int compareTo(final Name other) {
        return order.compare(this, other);
    }

    @Override
    public String toString() {
        return text + " of " + file;
    }

    private static final Comparator<Name> order = Comparator.comparing(Name::file).thenComparing(Name::text);
}
