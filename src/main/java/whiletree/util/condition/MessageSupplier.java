// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.util.condition;

/**
 * A lazily-evaluated trace message, built only when a handler asks for the active traces.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
