package org.pragmatica.pegvm.error;

/**
 * Raised by the instruction codec when an opcode receives an operand count outside its arity.
 */
public final class InstructionEncodingException extends IllegalArgumentException {
    private final GenerationError.EncodingArity error;

    public InstructionEncodingException(GenerationError.EncodingArity error) {
        super(error.message());
        this.error = error;
    }

    public GenerationError.EncodingArity error() {
        return error;
    }
}
