// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The core syntax of While: assignments and while loops over tree-valued expressions.
 */
@NonNullByDefault
package whiletree.syntax;

import whiletree.util.annotation.NonNullByDefault;
