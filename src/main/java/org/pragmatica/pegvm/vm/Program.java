package org.pragmatica.pegvm.vm;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;

import java.util.Optional;

/**
 * Executable output of the generator.
 *
 * <p>Instructions are addressed by their position in {@link #instructions()}. Every
 * {@code Match}, {@code CallA}, {@code CallB} and {@code StoreIfNotF} operand indexes the
 * matcher, action, predicate or string table respectively. {@link #instrToRule()} runs
 * parallel to the instructions and holds the owning rule index, or {@link #NO_RULE} for
 * the prologue.
 */
public record Program(
 String init,
 ImmutableList<ImmutableIntArray> instructions,
 ImmutableList<Matcher> matchers,
 ImmutableList<String> strings,
 ImmutableList<ThunkInfo> actionThunks,
 ImmutableList<ThunkInfo> predicateThunks,
 ImmutableIntArray instrToRule,
 ImmutableList<RuleInfo> rules) {

    public static final int NO_RULE = -1;

    public Program {
        Preconditions.checkArgument(instrToRule.length() == instructions.size(),
                                    "instrToRule has %s entries for %s instructions",
                                    instrToRule.length(),
                                    instructions.size());
    }

    public DecodedInstruction instruction(int address) {
        return InstructionCodec.decode(instructions.get(address));
    }

    public int size() {
        return instructions.size();
    }

    /**
     * Display name of the rule that owns the instruction, or empty for prologue instructions.
     */
    public Optional<String> ruleNameAt(int address) {
        Preconditions.checkElementIndex(address, instrToRule.length());
        var rule = instrToRule.get(address);
        if (rule == NO_RULE) {
            return Optional.empty();
        }
        return Optional.of(strings.get(rules.get(rule).displayNameIndex()));
    }

    /**
     * Failure diagnostic for the instruction at {@code address}.
     */
    public String describeFailure(int address) {
        return ruleNameAt(address).map(name -> String.format("rule %s failed at instruction %d", name, address))
                                  .orElseGet(() -> String.format("parse failed at instruction %d", address));
    }

    @Override
    public String toString() {
        return ProgramPrinter.print(this);
    }
}
