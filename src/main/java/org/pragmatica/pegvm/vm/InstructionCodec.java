package org.pragmatica.pegvm.vm;

import com.google.common.primitives.ImmutableIntArray;
import org.pragmatica.pegvm.error.GenerationError;
import org.pragmatica.pegvm.error.InstructionEncodingException;

/**
 * Packs an opcode and its operands into words and back.
 *
 * <p>Layout: the first word holds {@code opcode.code() << 2 | operandCount}; each following
 * word holds one signed operand. The operand count makes the format self-describing.
 */
public final class InstructionCodec {
    private static final int COUNT_BITS = 2;
    private static final int COUNT_MASK = (1 << COUNT_BITS) - 1;

    private InstructionCodec() {}

    /**
     * Encode one instruction.
     *
     * @throws InstructionEncodingException if the operand count is outside the opcode's arity
     */
    public static ImmutableIntArray encode(Opcode opcode, int... operands) {
        if (!opcode.accepts(operands.length)) {
            throw new InstructionEncodingException(new GenerationError.EncodingArity(opcode, operands.length));
        }
        var words = ImmutableIntArray.builder(operands.length + 1);
        words.add(opcode.code() << COUNT_BITS | operands.length);
        words.addAll(operands);
        return words.build();
    }

    /**
     * Decode the instruction held in {@code words}.
     */
    public static DecodedInstruction decode(ImmutableIntArray words) {
        if (words.isEmpty()) {
            throw new IllegalArgumentException("Empty instruction");
        }
        var header = words.get(0);
        var opcode = Opcode.fromCode(header >>> COUNT_BITS);
        var count = header & COUNT_MASK;
        if (words.length() != count + 1) {
            throw new IllegalArgumentException("Instruction " + opcode + " declares " + count
                                               + " operand(s) but has " + (words.length() - 1));
        }
        return new DecodedInstruction(opcode,
                                      count,
                                      count > 0 ? words.get(1) : 0,
                                      count > 1 ? words.get(2) : 0,
                                      count > 2 ? words.get(3) : 0);
    }
}
