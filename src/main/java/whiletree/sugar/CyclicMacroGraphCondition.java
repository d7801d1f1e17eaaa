// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.sugar;

import java.util.List;
import whiletree.util.condition.Condition;

/**
 * A condition type indicating that programs call each other as macros in a cycle, so inlining would never end.
 */
public final class CyclicMacroGraphCondition extends Condition {
    CyclicMacroGraphCondition(final List<String> cycle) {
        super("Macro calls form a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Retrieves the files on the cycle, starting and ending with the same file.
     */
    public List<String> cycle() {
        return cycle;
    }

    private final List<String> cycle;
}
