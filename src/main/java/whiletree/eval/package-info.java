// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A reference interpreter for core While programs.
 */
@NonNullByDefault
package whiletree.eval;

import whiletree.util.annotation.NonNullByDefault;
