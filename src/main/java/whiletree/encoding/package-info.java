// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Programs as data: quoting core syntax into trees, decoding trees back, and rendering trees as text.
 */
@NonNullByDefault
package whiletree.encoding;

import whiletree.util.annotation.NonNullByDefault;
