// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by the whole toolchain.
 */
@NonNullByDefault
package whiletree.util;

import whiletree.util.annotation.NonNullByDefault;
