package org.pragmatica.pegvm.vm;

/**
 * Instruction set of the backtracking parsing machine.
 *
 * <p>Each opcode carries a stable numeric code used in the encoded form and a closed
 * operand-count range. Address operands are absolute instruction indices.
 */
public enum Opcode {
    /** stack[, value]: push the cursor, or the given value, on the stack. */
    PUSH(0, "Push", 1, 2),
    /** stack: discard the top of the stack. */
    POP(1, "Pop", 1, 1),
    /** Pop a target from the call stack, push the return address and jump there. */
    CALL(2, "Call", 0, 0),
    /** Pop the return address from the call stack and jump there. */
    RETURN(3, "Return", 0, 0),
    /** Stop the machine. */
    EXIT(4, "Exit", 0, 0),
    /** matcher: try the matcher at the cursor. */
    MATCH(5, "Match", 1, 1),
    /** Pop a position; move the cursor back to it if the fail flag is set. */
    RESTORE_IF_F(6, "RestoreIfF", 0, 0),
    /** Pop a position and move the cursor back to it. */
    RESTORE(7, "Restore", 0, 0),
    /** address */
    JUMP(8, "Jump", 1, 1),
    /** address */
    JUMP_IF_F(9, "JumpIfF", 1, 1),
    /** address */
    JUMP_IF_NOT_F(10, "JumpIfNotF", 1, 1),
    /** thunk: run an action thunk. */
    CALL_A(11, "CallA", 1, 1),
    /** thunk: run a predicate thunk; the fail flag is set when it answers false. */
    CALL_B(12, "CallB", 1, 1),
    /** Invert the fail flag. */
    FLIP_F(13, "FlipF", 0, 0),
    /** Clear the fail flag. */
    CLEAR_F(14, "ClearF", 0, 0),
    /** Pop a repetition counter from the call stack; clear the fail flag if it is non-zero. */
    CUMUL_OR_F(15, "CumulOrF", 0, 0),
    /** label: pop a position; bind the label to the text since it, or unbind it when the fail flag is set. */
    STORE_IF_NOT_F(16, "StoreIfNotF", 1, 1),
    /** label: drop the label's binding in the current frame. */
    UNBIND(17, "Unbind", 1, 1);

    private static final Opcode[] BY_CODE = new Opcode[values().length];

    static {
        for (var op : values()) {
            BY_CODE[op.code] = op;
        }
    }

    private final int code;
    private final String mnemonic;
    private final int minOperands;
    private final int maxOperands;

    Opcode(int code, String mnemonic, int minOperands, int maxOperands) {
        this.code = code;
        this.mnemonic = mnemonic;
        this.minOperands = minOperands;
        this.maxOperands = maxOperands;
    }

    public int code() {
        return code;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public int minOperands() {
        return minOperands;
    }

    public int maxOperands() {
        return maxOperands;
    }

    public boolean accepts(int operandCount) {
        return operandCount >= minOperands && operandCount <= maxOperands;
    }

    public String arityDescription() {
        return minOperands == maxOperands
               ? String.valueOf(minOperands)
               : minOperands + ".." + maxOperands;
    }

    /**
     * Opcodes whose single operand is an absolute instruction address.
     */
    public boolean isJump() {
        return this == JUMP || this == JUMP_IF_F || this == JUMP_IF_NOT_F;
    }

    public static Opcode fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new IllegalArgumentException("Unknown opcode " + code);
        }
        return BY_CODE[code];
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
