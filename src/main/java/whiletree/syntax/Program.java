// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.syntax;

import java.util.List;

/**
 * A core While program: {@code read readVariable { block } write writeVariable}.
 * <p>
 * The read and write variables belong to the program's own file.
 *
 * @param file          The file the program was declared in, which also serves as its name.
 * @param readVariable  The variable bound to the input.
 * @param block         The program body.
 * @param writeVariable The variable whose final value is the output.
 */
public record Program(String file, Name readVariable, List<Command> block, Name writeVariable) {
    public Program {
        block = List.copyOf(block);
        if (!readVariable.file().equals(file) || !writeVariable.file().equals(file)) {
            throw new IllegalArgumentException(
                "Read and write variables of " + file + " must be declared in it, got "
                    + readVariable + " and " + writeVariable);
        }
    }
}
