// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Sugared While syntax and its translation into the core syntax.
 */
@NonNullByDefault
package whiletree.sugar;

import whiletree.util.annotation.NonNullByDefault;
