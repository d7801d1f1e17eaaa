// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package whiletree.test;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;
import java.util.stream.LongStream;
import whiletree.syntax.Command;
import whiletree.syntax.Expression;
import whiletree.syntax.Name;
import whiletree.syntax.Program;
import whiletree.tree.Tree;

final class RandomUtils {
    private RandomUtils() {
    }

    static RandomGenerator createGenerator(final long seed) {
        return factory.create(seed);
    }

    static long generateRandomSeed() {
        return SeedGenerator.generateSeed();
    }

    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(8);
    }

    /**
     * Generates a random tree with exactly {@code pairs} pairs.
     */
    static Tree generateTree(final RandomGenerator generator, final int pairs) {
        if (pairs == 0) {
            return Tree.nil();
        }
        final var headPairs = generator.nextInt(pairs);
        final var head = generateTree(generator, headPairs);
        return Tree.cons(head, generateTree(generator, pairs - 1 - headPairs));
    }

    /**
     * Generates a random core program without equality tests, so that it has a tree encoding.
     */
    static Program generateProgram(final RandomGenerator generator, final String file) {
        final var syntax = new SyntaxGenerator(generator, file);
        final var read = syntax.name();
        final var block = syntax.block(3);
        return new Program(file, read, block, syntax.name());
    }

    private static final RandomGeneratorFactory<?> factory = RandomGeneratorFactory.of("L32X64MixRandom");

    private static final class SeedGenerator {
        private static long generateSeed() {
            final var bytes = new byte[Long.BYTES];
            secureRandom.nextBytes(bytes);
            return (long) longView.get(bytes, 0);
        }

        private static final SecureRandom secureRandom = new SecureRandom();
        private static final VarHandle longView =
            MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.nativeOrder()).withInvokeExactBehavior();
    }

    private static final class SyntaxGenerator {
        private SyntaxGenerator(final RandomGenerator generator, final String file) {
            this.generator = generator;
            this.file = file;
        }

        private List<Command> block(final int depth) {
            final var size = generator.nextInt(4);
            final var commands = new ArrayList<Command>(size);
            for (int i = 0; i < size; i += 1) {
                commands.add(command(depth));
            }
            return commands;
        }

        private Command command(final int depth) {
            final var choice = (depth == 0) ? 0 : generator.nextInt(3);
            return switch (choice) {
                case 0 -> new Command.Assign(name(), expression(depth));
                case 1 -> new Command.While(expression(depth), block(depth - 1));
                default -> new Command.IfElse(expression(depth), block(depth - 1), block(depth - 1));
            };
        }

        private Expression expression(final int depth) {
            final var choice = (depth == 0) ? generator.nextInt(2) : generator.nextInt(5);
            return switch (choice) {
                case 0 -> Expression.var(name());
                case 1 -> new Expression.Literal(generateTree(generator, generator.nextInt(6)));
                case 2 -> new Expression.Head(expression(depth - 1));
                case 3 -> new Expression.Tail(expression(depth - 1));
                default -> new Expression.Cons(expression(depth - 1), expression(depth - 1));
            };
        }

        private Name name() {
            return new Name(file, variableTexts.get(generator.nextInt(variableTexts.size())));
        }

        private static final List<String> variableTexts = List.of("X", "Y", "Z", "counter", "result");

        private final RandomGenerator generator;
        private final String file;
    }
}
