// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.eval;

import whiletree.util.condition.Condition;

/**
 * A condition type indicating that a program ran more loop iterations than the {@link Evaluator} allows.
 */
public final class StepLimitExceededCondition extends Condition {
    StepLimitExceededCondition(final long stepLimit) {
        super("Program exceeded the limit of " + stepLimit + " loop iterations");
    }
}
