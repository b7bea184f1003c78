package org.pragmatica.pegvm.generator;

/**
 * Operand of an instruction that has not been placed at its final address yet.
 */
sealed interface Operand {

    /**
     * Final operand value once the owning fragment starts at {@code base}.
     */
    int resolve(int base, int[] ruleEntries);

    /**
     * The same operand after the owning fragment has been appended {@code distance} instructions later.
     */
    Operand shift(int distance);

    /**
     * Plain value: table index, stack id or counter.
     */
    record Immediate(int value) implements Operand {
        @Override
        public int resolve(int base, int[] ruleEntries) {
            return value;
        }

        @Override
        public Operand shift(int distance) {
            return this;
        }
    }

    /**
     * Address relative to the start of the owning fragment.
     */
    record Relative(int offset) implements Operand {
        @Override
        public int resolve(int base, int[] ruleEntries) {
            return base + offset;
        }

        @Override
        public Operand shift(int distance) {
            return new Relative(offset + distance);
        }
    }

    /**
     * Entry address of a rule, known only once every rule has been sized.
     */
    record RuleEntry(int ruleIndex) implements Operand {
        @Override
        public int resolve(int base, int[] ruleEntries) {
            if (ruleIndex < 0 || ruleIndex >= ruleEntries.length) {
                throw new IllegalStateException("No entry address for rule " + ruleIndex);
            }
            return ruleEntries[ruleIndex];
        }

        @Override
        public Operand shift(int distance) {
            return this;
        }
    }
}
