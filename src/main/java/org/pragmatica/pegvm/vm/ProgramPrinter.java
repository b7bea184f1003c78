package org.pragmatica.pegvm.vm;

/**
 * Renders a program as an annotated listing, one instruction per line.
 *
 * <pre>
 *    0  Push        cstack, 3
 *    1  Call
 *    2  Exit
 *    3  Push        pstack                   ; A
 *    4  Match       0 "a"                    ; A
 * </pre>
 */
public final class ProgramPrinter {
    private static final int COMMENT_COLUMN = 40;
    private static final int MAX_CODE_PREVIEW = 24;

    private ProgramPrinter() {}

    public static String print(Program program) {
        var sb = new StringBuilder();
        program.init()
               .lines()
               .forEach(line -> sb.append("; init: ").append(line).append('\n'));
        for (int address = 0; address < program.size(); address++) {
            var line = new StringBuilder();
            line.append(String.format("%4d  ", address));
            appendInstruction(line, program, program.instruction(address));
            program.ruleNameAt(address)
                   .ifPresent(name -> {
                       while (line.length() < COMMENT_COLUMN) {
                           line.append(' ');
                       }
                       line.append(" ; ").append(name);
                   });
            sb.append(line.toString().stripTrailing()).append('\n');
        }
        return sb.toString();
    }

    private static void appendInstruction(StringBuilder sb, Program program, DecodedInstruction instr) {
        sb.append(String.format("%-12s", instr.opcode().mnemonic()));
        switch (instr.opcode()) {
            case PUSH, POP -> {
                sb.append(StackId.fromId(instr.operand0()).shortName());
                if (instr.operandCount() > 1) {
                    sb.append(", ").append(instr.operand1());
                }
            }
            case MATCH -> sb.append(instr.operand0())
                            .append(' ')
                            .append(program.matchers().get(instr.operand0()));
            case CALL_A -> appendThunk(sb, instr.operand0(), program.actionThunks().get(instr.operand0()));
            case CALL_B -> appendThunk(sb, instr.operand0(), program.predicateThunks().get(instr.operand0()));
            case STORE_IF_NOT_F, UNBIND -> sb.append(instr.operand0())
                                     .append(' ')
                                     .append(program.strings().get(instr.operand0()));
            default -> {
                if (instr.operandCount() > 0) {
                    sb.append(instr.operand0());
                }
            }
        }
    }

    private static void appendThunk(StringBuilder sb, int index, ThunkInfo thunk) {
        var code = thunk.code().strip().replaceAll("\\s+", " ");
        if (code.length() > MAX_CODE_PREVIEW) {
            code = code.substring(0, MAX_CODE_PREVIEW) + "...";
        }
        sb.append(index).append(" {").append(code).append('}');
    }
}
