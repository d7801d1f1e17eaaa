// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.tree.reader;

record SourceLocation(int column, int formStartColumn) {
    @Override
    public String toString() {
        return "At column " + column + ", within the tree starting at column " + formStartColumn;
    }
}
