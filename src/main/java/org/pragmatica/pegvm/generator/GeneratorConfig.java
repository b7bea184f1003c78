package org.pragmatica.pegvm.generator;

/**
 * Program generator options.
 *
 * @param traceProgram log the disassembled program at TRACE level once generated
 */
public record GeneratorConfig(
    boolean traceProgram
) {
    public static final GeneratorConfig DEFAULT = new GeneratorConfig(
        false
    );
}
