// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system, used to report problems with the programs being compiled.
 */
@NonNullByDefault
package whiletree.util.condition;

import whiletree.util.annotation.NonNullByDefault;
