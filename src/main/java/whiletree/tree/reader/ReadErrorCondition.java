// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.tree.reader;

import whiletree.util.condition.Condition;

/**
 * A condition type indicating that a tree literal could not be read.
 */
public final class ReadErrorCondition extends Condition {
    ReadErrorCondition(final String rawMessage, final SourceLocation location) {
        super(rawMessage);
        sourceLocation = location;
    }

    /**
     * Retrieves the 1-based column at which the problem was found.
     */
    public int column() {
        return sourceLocation.column();
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + sourceLocation;
    }

    private final SourceLocation sourceLocation;
}
