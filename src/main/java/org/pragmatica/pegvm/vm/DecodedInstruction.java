package org.pragmatica.pegvm.vm;

/**
 * An instruction unpacked from its words. Operands beyond {@code operandCount} are zero.
 */
public record DecodedInstruction(Opcode opcode, int operandCount, int operand0, int operand1, int operand2) {

    public int operand(int index) {
        if (index < 0 || index >= operandCount) {
            throw new IndexOutOfBoundsException("Operand " + index + " of " + opcode + " with " + operandCount + " operand(s)");
        }
        return switch (index) {
            case 0 -> operand0;
            case 1 -> operand1;
            default -> operand2;
        };
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(opcode.mnemonic());
        for (int i = 0; i < operandCount; i++) {
            sb.append(i == 0 ? " " : ", ").append(operand(i));
        }
        return sb.toString();
    }
}
