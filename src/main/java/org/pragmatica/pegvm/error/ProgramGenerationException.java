package org.pragmatica.pegvm.error;

/**
 * Raised when program generation fails. No partial program exists when this is thrown.
 */
public final class ProgramGenerationException extends Exception {
    private final GenerationError error;

    public ProgramGenerationException(GenerationError error) {
        super(error.message());
        this.error = error;
    }

    public ProgramGenerationException(GenerationError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public GenerationError error() {
        return error;
    }
}
