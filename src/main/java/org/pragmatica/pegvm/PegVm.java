package org.pragmatica.pegvm;

import org.pragmatica.pegvm.error.ProgramGenerationException;
import org.pragmatica.pegvm.generator.GeneratorConfig;
import org.pragmatica.pegvm.generator.ProgramGenerator;
import org.pragmatica.pegvm.grammar.Grammar;
import org.pragmatica.pegvm.vm.Program;
import org.pragmatica.pegvm.vm.ProgramPrinter;

/**
 * Entry point for turning grammars into parsing machine programs.
 *
 * <p>Example usage:
 * <pre>{@code
 * var grammar = Grammar.of(
 *     Rule.of("Number", Expression.oneOrMore(Expression.charClass("[0-9]"))));
 *
 * var program = PegVm.generate(grammar);
 * System.out.println(PegVm.disassemble(program));
 * }</pre>
 */
public final class PegVm {
    private PegVm() {}

    /**
     * Generate a program with the default configuration.
     */
    public static Program generate(Grammar grammar) throws ProgramGenerationException {
        return generate(grammar, GeneratorConfig.DEFAULT);
    }

    /**
     * Generate a program with a custom configuration.
     */
    public static Program generate(Grammar grammar, GeneratorConfig config) throws ProgramGenerationException {
        return ProgramGenerator.create(config)
                               .generate(grammar);
    }

    /**
     * Annotated listing of a program.
     */
    public static String disassemble(Program program) {
        return ProgramPrinter.print(program);
    }

    /**
     * Create a builder for generator configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean traceProgram = false;

        private Builder() {}

        public Builder traceProgram(boolean enabled) {
            this.traceProgram = enabled;
            return this;
        }

        public GeneratorConfig config() {
            return new GeneratorConfig(traceProgram);
        }

        public Program generate(Grammar grammar) throws ProgramGenerationException {
            return PegVm.generate(grammar, config());
        }
    }
}
