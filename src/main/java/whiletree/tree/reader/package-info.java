// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Reading tree values from the textual forms the renderers produce.
 */
@NonNullByDefault
package whiletree.tree.reader;

import whiletree.util.annotation.NonNullByDefault;
