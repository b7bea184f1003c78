package org.pragmatica.pegvm.error;

import org.pragmatica.pegvm.tree.SourceSpan;
import org.pragmatica.pegvm.vm.Opcode;

/**
 * Reasons a grammar cannot be turned into a program.
 */
public sealed interface GenerationError {

    String message();

    /**
     * The grammar declares no rule, so there is no entry point.
     */
    record NoRules() implements GenerationError {
        @Override
        public String message() {
            return "Grammar has no rule";
        }
    }

    /**
     * A rule reference names a rule the grammar does not declare.
     */
    record UndefinedRule(
    SourceSpan span,
    String ruleName,
    String referencingRule) implements GenerationError {
        @Override
        public String message() {
            return "Undefined rule reference: '" + ruleName + "' in rule '" + referencingRule + "' at " + span.start();
        }
    }

    /**
     * An opcode was emitted with an operand count outside its arity. Always a generator defect.
     */
    record EncodingArity(
    Opcode opcode,
    int operandCount) implements GenerationError {
        @Override
        public String message() {
            return "Opcode " + opcode + " accepts " + opcode.arityDescription()
                   + " operand(s), got " + operandCount;
        }
    }
}
