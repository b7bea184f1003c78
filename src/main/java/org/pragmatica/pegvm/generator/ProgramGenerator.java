package org.pragmatica.pegvm.generator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import org.pragmatica.pegvm.error.GenerationError;
import org.pragmatica.pegvm.error.InstructionEncodingException;
import org.pragmatica.pegvm.error.ProgramGenerationException;
import org.pragmatica.pegvm.grammar.Grammar;
import org.pragmatica.pegvm.grammar.Rule;
import org.pragmatica.pegvm.vm.Opcode;
import org.pragmatica.pegvm.vm.Program;
import org.pragmatica.pegvm.vm.ProgramPrinter;
import org.pragmatica.pegvm.vm.RuleInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Generates a machine program from a grammar.
 *
 * <p>Layout of the generated program:
 * <pre>
 *   0  Push cstack, entry(rule 0)   ; prologue, not owned by any rule
 *   1  Call
 *   2  Exit
 *   3  rule 0: Push pstack ... RestoreIfF Return
 *      rule 1: ...
 * </pre>
 * Rules are laid out in declaration order. Rule entry addresses are known only once every rule
 * has been compiled, so calls and jumps are resolved in a second pass.
 *
 * <p>A generator holds no state between runs and may be shared.
 */
public final class ProgramGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgramGenerator.class);

    private final GeneratorConfig config;

    private ProgramGenerator(GeneratorConfig config) {
        this.config = config;
    }

    public static ProgramGenerator create() {
        return new ProgramGenerator(GeneratorConfig.DEFAULT);
    }

    public static ProgramGenerator create(GeneratorConfig config) {
        return new ProgramGenerator(config);
    }

    /**
     * Generate the program for {@code grammar}.
     *
     * @throws ProgramGenerationException if the grammar has no rule, references an undeclared rule,
     *                                    or an instruction cannot be encoded
     */
    public Program generate(Grammar grammar) throws ProgramGenerationException {
        var assembly = new Assembly(grammar);
        try {
            assembly.validate();
            assembly.compileRules();
            assembly.resolveAddresses();
            var program = assembly.finish();
            LOGGER.debug("Generated {} instruction(s) for {} rule(s): {} matcher(s), {} string(s), {} action(s), {} predicate(s)",
                         program.size(),
                         program.rules().size(),
                         program.matchers().size(),
                         program.strings().size(),
                         program.actionThunks().size(),
                         program.predicateThunks().size());
            if (config.traceProgram() && LOGGER.isTraceEnabled()) {
                LOGGER.trace("Program:\n{}", ProgramPrinter.print(program));
            }
            return program;
        } catch (InstructionEncodingException e) {
            throw new ProgramGenerationException(e.error(), e);
        }
    }

    private enum Stage {
        EMPTY,
        VALIDATED,
        RULES_COMPILED,
        ADDRESSES_RESOLVED,
        DONE
    }

    /**
     * State of a single generation run.
     */
    private static final class Assembly {
        private static final int PROLOGUE_SIZE = 3;

        private final Grammar grammar;
        private final TableBuilder tables = new TableBuilder();
        private final List<Fragment> ruleFragments = new ArrayList<>();
        private final List<RuleInfo> ruleInfos = new ArrayList<>();
        private Stage stage = Stage.EMPTY;
        private int[] entries;
        private ImmutableList<ImmutableIntArray> instructions;
        private ImmutableIntArray instrToRule;

        private Assembly(Grammar grammar) {
            this.grammar = grammar;
        }

        void validate() throws ProgramGenerationException {
            advance(Stage.EMPTY, Stage.VALIDATED);
            if (grammar.rules().isEmpty()) {
                throw new ProgramGenerationException(new GenerationError.NoRules());
            }
            var problem = grammar.validate();
            if (problem.isPresent()) {
                throw new ProgramGenerationException(problem.get());
            }
        }

        void compileRules() {
            advance(Stage.VALIDATED, Stage.RULES_COMPILED);
            Map<String, Integer> ruleIndices = grammar.ruleIndexMap();
            var rules = grammar.rules();
            for (int index = 0; index < rules.size(); index++) {
                var rule = rules.get(index);
                var nameIndex = tables.insertString(rule.name());
                var displayNameIndex = rule.hasDistinctDisplayName()
                                       ? tables.insertString(rule.effectiveDisplayName())
                                       : nameIndex;
                var fragment = new ExpressionCompiler(tables, ruleIndices, index).compileRule(rule);
                ruleFragments.add(fragment);
                // entry filled in once every rule is sized
                ruleInfos.add(new RuleInfo(nameIndex, displayNameIndex, -1));
                logRule(rule, fragment);
            }
        }

        void resolveAddresses() {
            advance(Stage.RULES_COMPILED, Stage.ADDRESSES_RESOLVED);
            entries = new int[ruleFragments.size()];
            var address = PROLOGUE_SIZE;
            for (int i = 0; i < entries.length; i++) {
                entries[i] = address;
                address += ruleFragments.get(i).size();
                var info = ruleInfos.get(i);
                ruleInfos.set(i, new RuleInfo(info.nameIndex(), info.displayNameIndex(), entries[i]));
            }

            var encoded = ImmutableList.<ImmutableIntArray>builderWithExpectedSize(address);
            var owners = ImmutableIntArray.builder(address);

            var prologue = prologue();
            Preconditions.checkState(prologue.size() == PROLOGUE_SIZE, "Prologue has %s instructions", prologue.size());
            encoded.addAll(prologue.resolve(0, entries));
            for (int i = 0; i < PROLOGUE_SIZE; i++) {
                owners.add(Program.NO_RULE);
            }
            for (int rule = 0; rule < entries.length; rule++) {
                var fragment = ruleFragments.get(rule);
                encoded.addAll(fragment.resolve(entries[rule], entries));
                for (int i = 0; i < fragment.size(); i++) {
                    owners.add(rule);
                }
            }
            instructions = encoded.build();
            instrToRule = owners.build();
        }

        Program finish() {
            advance(Stage.ADDRESSES_RESOLVED, Stage.DONE);
            return new Program(grammar.init().orElse(""),
                               instructions,
                               tables.matchers(),
                               tables.strings(),
                               tables.actionThunks(),
                               tables.predicateThunks(),
                               instrToRule,
                               ImmutableList.copyOf(ruleInfos));
        }

        /**
         * {@code Push(cstack, entry(rule 0)) Call Exit}
         */
        private static Fragment prologue() {
            return Fragment.builder()
                           .emitCall(0)
                           .emit(Opcode.EXIT)
                           .build();
        }

        private void advance(Stage expected, Stage next) {
            Preconditions.checkState(stage == expected, "Cannot move to %s from %s", next, stage);
            stage = next;
        }

        private static void logRule(Rule rule, Fragment fragment) {
            LOGGER.debug("Compiled rule '{}' into {} instruction(s)", rule.name(), fragment.size());
        }
    }
}
