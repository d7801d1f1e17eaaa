// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.sugar;

import whiletree.util.condition.Condition;

/**
 * A condition type indicating that a program calls a macro file that isn't among the programs supplied for
 * desugaring.
 */
public final class UnknownMacroCondition extends Condition {
    UnknownMacroCondition(final String caller, final String file) {
        super("Program " + caller + " calls macro " + file + ", which was not supplied");
        this.file = file;
    }

    /**
     * Retrieves the macro file that couldn't be found.
     */
    public String file() {
        return file;
    }

    private final String file;
}
