// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.encoding;

import whiletree.util.condition.Condition;

/**
 * A condition type indicating that the {@link Quoter} was given syntax the tree encoding has no tag for.
 */
public final class UnencodableSyntaxCondition extends Condition {
    UnencodableSyntaxCondition(final String message) {
        super(message);
    }
}
