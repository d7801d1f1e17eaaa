// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.encoding;

/**
 * The verbosity modes of {@link TreeRenderer#render(whiletree.tree.Tree, RenderMode)}.
 */
public enum RenderMode {
    /**
     * Naturals as decimal numbers, anything else in dotted pair notation.
     */
    RAW,
    /**
     * Naturals as decimal numbers, anything else as a list of recursively rendered elements.
     */
    NESTED_LIST,
    /**
     * Like {@link #NESTED_LIST}, except that the first element of every list is shown as an atom symbol when it is one.
     */
    ATOM_TAGGED,
}
