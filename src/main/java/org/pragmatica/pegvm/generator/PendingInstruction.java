package org.pragmatica.pegvm.generator;

import org.pragmatica.pegvm.vm.Opcode;

import java.util.List;

/**
 * An instruction whose address operands are still symbolic.
 */
record PendingInstruction(Opcode opcode, List<Operand> operands) {

    PendingInstruction {
        operands = List.copyOf(operands);
    }

    PendingInstruction shift(int distance) {
        if (distance == 0) {
            return this;
        }
        return new PendingInstruction(opcode,
                                      operands.stream()
                                              .map(operand -> operand.shift(distance))
                                              .toList());
    }

    int[] resolve(int base, int[] ruleEntries) {
        var values = new int[operands.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = operands.get(i).resolve(base, ruleEntries);
        }
        return values;
    }
}
