package org.pragmatica.pegvm.generator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import org.pragmatica.pegvm.error.GenerationError;
import org.pragmatica.pegvm.error.InstructionEncodingException;
import org.pragmatica.pegvm.vm.InstructionCodec;
import org.pragmatica.pegvm.vm.Opcode;
import org.pragmatica.pegvm.vm.StackId;

import java.util.ArrayList;
import java.util.List;

/**
 * Contiguous, relocatable run of instructions.
 *
 * <p>Jump targets inside a fragment are kept relative to its first instruction and rule calls
 * name the callee by index, so a fragment can be nested in another one or placed anywhere in
 * the program. {@link #resolve(int, int[])} turns it into encoded instructions once the base
 * address and every rule entry address are known.
 */
final class Fragment {
    private final ImmutableList<PendingInstruction> instructions;

    private Fragment(ImmutableList<PendingInstruction> instructions) {
        this.instructions = instructions;
    }

    static Builder builder() {
        return new Builder();
    }

    int size() {
        return instructions.size();
    }

    ImmutableList<PendingInstruction> instructions() {
        return instructions;
    }

    ImmutableList<ImmutableIntArray> resolve(int base, int[] ruleEntries) {
        var encoded = ImmutableList.<ImmutableIntArray>builderWithExpectedSize(instructions.size());
        for (var instruction : instructions) {
            encoded.add(InstructionCodec.encode(instruction.opcode(), instruction.resolve(base, ruleEntries)));
        }
        return encoded.build();
    }

    /**
     * Forward or backward jump target inside the fragment being built.
     */
    static final class Label {
        private int offset = -1;

        boolean isBound() {
            return offset >= 0;
        }
    }

    private record Fixup(int instruction, Label label) {}

    static final class Builder {
        private final List<PendingInstruction> instructions = new ArrayList<>();
        private final List<Fixup> fixups = new ArrayList<>();

        private Builder() {}

        Label newLabel() {
            return new Label();
        }

        /**
         * Attach the label to the next instruction emitted (or to the end of the fragment).
         */
        Builder bind(Label label) {
            Preconditions.checkState(!label.isBound(), "Label bound twice");
            label.offset = instructions.size();
            return this;
        }

        Builder emit(Opcode opcode, int... operands) {
            var list = new ArrayList<Operand>(operands.length);
            for (var operand : operands) {
                list.add(new Operand.Immediate(operand));
            }
            return add(opcode, list);
        }

        Builder emitPush(StackId stack) {
            return emit(Opcode.PUSH, stack.id());
        }

        Builder emitPush(StackId stack, int value) {
            return emit(Opcode.PUSH, stack.id(), value);
        }

        Builder emitJump(Opcode opcode, Label target) {
            Preconditions.checkArgument(opcode.isJump(), "%s is not a jump", opcode);
            fixups.add(new Fixup(instructions.size(), target));
            return add(opcode, List.of(new Operand.Relative(0)));
        }

        /**
         * {@code Push(cstack, entry(rule)) Call}
         */
        Builder emitCall(int ruleIndex) {
            add(Opcode.PUSH, List.of(new Operand.Immediate(StackId.CALL.id()), new Operand.RuleEntry(ruleIndex)));
            return emit(Opcode.CALL);
        }

        Builder append(Fragment fragment) {
            var distance = instructions.size();
            for (var instruction : fragment.instructions) {
                instructions.add(instruction.shift(distance));
            }
            return this;
        }

        int size() {
            return instructions.size();
        }

        Fragment build() {
            for (var fixup : fixups) {
                Preconditions.checkState(fixup.label().isBound(), "Jump at offset %s targets an unbound label", fixup.instruction());
                var pending = instructions.get(fixup.instruction());
                instructions.set(fixup.instruction(),
                                 new PendingInstruction(pending.opcode(), List.of(new Operand.Relative(fixup.label().offset))));
            }
            return new Fragment(ImmutableList.copyOf(instructions));
        }

        private Builder add(Opcode opcode, List<Operand> operands) {
            if (!opcode.accepts(operands.size())) {
                throw new InstructionEncodingException(new GenerationError.EncodingArity(opcode, operands.size()));
            }
            instructions.add(new PendingInstruction(opcode, operands));
            return this;
        }
    }
}
