// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * While tree values, the language's only data type.
 */
@NonNullByDefault
package whiletree.tree;

import whiletree.util.annotation.NonNullByDefault;
