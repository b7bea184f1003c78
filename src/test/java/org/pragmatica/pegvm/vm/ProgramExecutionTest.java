package org.pragmatica.pegvm.vm;

import org.junit.jupiter.api.Test;
import org.pragmatica.pegvm.PegVm;
import org.pragmatica.pegvm.error.ProgramGenerationException;
import org.pragmatica.pegvm.grammar.Grammar;
import org.pragmatica.pegvm.grammar.Rule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.pegvm.grammar.Expression.*;

/**
 * Runs generated programs on the reference machine to check that the emitted code
 * behaves like the grammar says.
 */
class ProgramExecutionTest {

    private static ReferenceMachine machine(Rule... rules) throws ProgramGenerationException {
        return ReferenceMachine.of(PegVm.generate(Grammar.of(rules)));
    }

    private static ReferenceMachine.Outcome runBalanced(ReferenceMachine machine, String input) {
        var outcome = machine.run(input);
        assertTrue(outcome.balanced(), "stacks not empty at exit for '" + input + "'");
        return outcome;
    }

    // === Terminals ===

    @Test
    void literal_matchesExactText() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", literal("abc")));

        assertTrue(vm.accepts("abc"));
        assertFalse(vm.accepts("abd"));
        assertFalse(vm.accepts("ab"));
    }

    @Test
    void literal_caseInsensitive_ignoresCase() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", literalIgnoreCase("select")));

        assertTrue(vm.accepts("SeLeCt"));
        assertFalse(vm.accepts("selec"));
    }

    @Test
    void charClassAndAny_matchSingleCharacters() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", sequence(charClass("[a-z]"), any(), charClass("[^0-9]"))));

        assertTrue(vm.accepts("x9y"));
        assertFalse(vm.accepts("x99"));
        assertFalse(vm.accepts("X9y"));
    }

    // === Sequence and choice ===

    @Test
    void sequence_failureRestoresCursor() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", sequence(literal("a"), literal("b"))));

        var outcome = runBalanced(vm, "ac");
        assertFalse(outcome.matched());
        assertEquals(0, outcome.consumed());
    }

    @Test
    void choice_isOrdered() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", choice(literal("a"), literal("ab"))));

        var outcome = runBalanced(vm, "ab");
        assertTrue(outcome.matched());
        assertEquals(1, outcome.consumed());
    }

    @Test
    void choice_backtracksToNextAlternative() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", choice(sequence(literal("a"), literal("b")),
                                              sequence(literal("a"), literal("c")),
                                              literal("d"))));

        assertTrue(vm.accepts("ab"));
        assertTrue(vm.accepts("ac"));
        assertTrue(vm.accepts("d"));
        assertFalse(vm.accepts("ad"));
        assertEquals(0, runBalanced(vm, "ax").consumed());
    }

    // === Repetition ===

    @Test
    void zeroOrMore_acceptsEmptyAndRepeated() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", zeroOrMore(literal("a"))));

        assertTrue(vm.accepts(""));
        assertTrue(vm.accepts("aaaa"));
        assertEquals(2, runBalanced(vm, "aab").consumed());
    }

    @Test
    void oneOrMore_requiresOneIteration() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", oneOrMore(charClass("[0-9]"))));

        var empty = runBalanced(vm, "");
        assertFalse(empty.matched());
        assertTrue(vm.accepts("7"));
        assertTrue(vm.accepts("123"));
        assertEquals(2, runBalanced(vm, "12x").consumed());
    }

    @Test
    void oneOrMore_insideSequence() throws ProgramGenerationException {
        var digits = oneOrMore(charClass("[0-9]"));
        var vm = machine(Rule.of("Decimal", sequence(digits, literal("."), digits)));

        assertTrue(vm.accepts("3.14"));
        assertFalse(vm.accepts("3."));
        assertFalse(vm.accepts(".5"));
    }

    @Test
    void repetitionOfSequence_backtracksPartialIteration() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", sequence(zeroOrMore(sequence(literal("a"), literal("b"))), literal("a"))));

        assertTrue(vm.accepts("ababa"));
        assertTrue(vm.accepts("a"));
        assertFalse(vm.accepts("abab"));
    }

    @Test
    void optional_alwaysSucceeds() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", sequence(optional(literal("-")), literal("1"))));

        assertTrue(vm.accepts("1"));
        assertTrue(vm.accepts("-1"));
        assertFalse(vm.accepts("+1"));
    }

    // === Lookahead ===

    @Test
    void andPredicate_consumesNothing() throws ProgramGenerationException {
        var vm = machine(Rule.of("A", sequence(and(literal("ab")), literal("a"))));

        var outcome = runBalanced(vm, "ab");
        assertTrue(outcome.matched());
        assertEquals(1, outcome.consumed());
        assertFalse(runBalanced(vm, "ac").matched());
    }

    @Test
    void notPredicate_invertsResult() throws ProgramGenerationException {
        var keyword = sequence(literal("if"), not(charClass("[a-z]")));
        var vm = machine(Rule.of("Keyword", keyword));

        assertTrue(vm.accepts("if"));
        assertEquals(2, runBalanced(vm, "if(").consumed());
        var outcome = runBalanced(vm, "iffy");
        assertFalse(outcome.matched());
        assertEquals(0, outcome.consumed());
    }

    @Test
    void notPredicate_untilTerminator() throws ProgramGenerationException {
        var vm = machine(Rule.of("Comment", sequence(literal("/*"),
                                                     zeroOrMore(sequence(not(literal("*/")), any())),
                                                     literal("*/"))));

        assertTrue(vm.accepts("/* note */"));
        assertTrue(vm.accepts("/**/"));
        assertFalse(vm.accepts("/* open"));
    }

    // === Rules ===

    @Test
    void ruleReference_callsAndReturns() throws ProgramGenerationException {
        var vm = machine(Rule.of("Pair", sequence(ref("Digit"), literal(","), ref("Digit"))),
                         Rule.of("Digit", charClass("[0-9]")));

        assertTrue(vm.accepts("1,2"));
        assertFalse(vm.accepts("1,x"));
    }

    @Test
    void recursiveRule_matchesNesting() throws ProgramGenerationException {
        var vm = machine(Rule.of("Parens", sequence(literal("("), optional(ref("Parens")), literal(")"))));

        assertTrue(vm.accepts("()"));
        assertTrue(vm.accepts("((()))"));
        assertFalse(vm.accepts("(()"));
    }

    @Test
    void failedRuleCall_restoresCursor() throws ProgramGenerationException {
        var vm = machine(Rule.of("Start", choice(ref("Ab"), ref("Ac"))),
                         Rule.of("Ab", sequence(literal("a"), literal("b"))),
                         Rule.of("Ac", sequence(literal("a"), literal("c"))));

        assertTrue(vm.accepts("ac"));
        assertTrue(vm.accepts("ab"));
    }

    // === Labels, actions and predicates ===

    @Test
    void action_receivesLabeledText() throws ProgramGenerationException {
        var program = PegVm.generate(Grammar.of(
            Rule.of("Sum", action(sequence(labeled("a", ref("Num")), literal("+"), labeled("b", ref("Num"))), "sum")),
            Rule.of("Num", oneOrMore(charClass("[0-9]")))));
        Map<String, Function<List<String>, Object>> actions =
            Map.of("sum", args -> Integer.parseInt(args.get(0)) + Integer.parseInt(args.get(1)));
        var vm = ReferenceMachine.of(program, actions, Map.of());

        var outcome = runBalanced(vm, "12+30");
        assertTrue(outcome.matched());
        assertEquals(42, outcome.value());
    }

    @Test
    void action_notRunWhenExpressionFails() throws ProgramGenerationException {
        var program = PegVm.generate(Grammar.of(
            Rule.of("A", choice(action(literal("x"), "never"), literal("y")))));
        Map<String, Function<List<String>, Object>> actions = Map.of("never", args -> {
            throw new AssertionError("action must not run");
        });
        var vm = ReferenceMachine.of(program, actions, Map.of());

        var outcome = runBalanced(vm, "y");
        assertTrue(outcome.matched());
        assertNull(outcome.value());
    }

    @Test
    void semanticPredicate_controlsSuccess() throws ProgramGenerationException {
        var program = PegVm.generate(Grammar.of(
            Rule.of("Even", sequence(labeled("n", oneOrMore(charClass("[0-9]"))), predicate("even")))));
        Map<String, Predicate<List<String>>> predicates =
            Map.of("even", args -> Integer.parseInt(args.get(0)) % 2 == 0);
        var vm = ReferenceMachine.of(program, Map.of(), predicates);

        assertTrue(vm.accepts("42"));
        var odd = runBalanced(vm, "43");
        assertFalse(odd.matched());
        assertEquals(0, odd.consumed());
    }

    @Test
    void labels_areLocalToRuleInvocation() throws ProgramGenerationException {
        var program = PegVm.generate(Grammar.of(
            Rule.of("A", action(sequence(labeled("x", literal("a")), ref("B")), "outer")),
            Rule.of("B", labeled("x", literal("b")))));
        Map<String, Function<List<String>, Object>> actions = Map.of("outer", args -> args.get(0));
        var vm = ReferenceMachine.of(program, actions, Map.of());

        assertEquals("a", runBalanced(vm, "ab").value());
    }

    @Test
    void labelInSkippedOptional_isUnbound() throws ProgramGenerationException {
        var program = PegVm.generate(Grammar.of(
            Rule.of("Signed", action(sequence(optional(labeled("sign", literal("-"))),
                                              labeled("digits", oneOrMore(charClass("[0-9]")))), "signed"))));
        Map<String, Function<List<String>, Object>> actions =
            Map.of("signed", args -> (args.get(0) == null ? "+" : args.get(0)) + args.get(1));
        var vm = ReferenceMachine.of(program, actions, Map.of());

        assertEquals("+12", runBalanced(vm, "12").value());
        assertEquals("-12", runBalanced(vm, "-12").value());
    }

    @Test
    void labelInBacktrackedAlternative_isUnbound() throws ProgramGenerationException {
        var program = PegVm.generate(Grammar.of(
            Rule.of("A", action(choice(sequence(labeled("x", literal("a")), literal("b")),
                                       sequence(literal("a"), literal("c"))), "pick"))));
        Map<String, Function<List<String>, Object>> actions = Map.of("pick", args -> String.valueOf(args.get(0)));
        var vm = ReferenceMachine.of(program, actions, Map.of());

        assertEquals("null", runBalanced(vm, "ac").value());
        assertEquals("a", runBalanced(vm, "ab").value());
    }

    @Test
    void labelSkippedInLaterIteration_isUnbound() throws ProgramGenerationException {
        var signs = new ArrayList<String>();
        var program = PegVm.generate(Grammar.of(
            Rule.of("L", oneOrMore(action(sequence(optional(labeled("s", literal("-"))), charClass("[0-9]")), "item")))));
        Map<String, Function<List<String>, Object>> actions = Map.of("item", args -> signs.add(args.get(0)));
        var vm = ReferenceMachine.of(program, actions, Map.of());

        assertTrue(runBalanced(vm, "-12").matched());
        assertEquals(Arrays.asList("-", null), signs);
    }

    @Test
    void labelInUntakenAlternative_isUnboundInLaterIteration() throws ProgramGenerationException {
        var signs = new ArrayList<String>();
        var program = PegVm.generate(Grammar.of(
            Rule.of("L", oneOrMore(action(sequence(choice(literal("+"), labeled("s", literal("-"))),
                                                   charClass("[0-9]")), "item")))));
        Map<String, Function<List<String>, Object>> actions = Map.of("item", args -> signs.add(args.get(0)));
        var vm = ReferenceMachine.of(program, actions, Map.of());

        assertTrue(vm.accepts("-1+2"));
        assertEquals(Arrays.asList("-", null), signs);
    }

    @Test
    void labelInsideFailedNotPredicate_isUnbound() throws ProgramGenerationException {
        var program = PegVm.generate(Grammar.of(
            Rule.of("A", action(sequence(optional(not(labeled("x", literal("a")))), literal("a")), "seen"))));
        Map<String, Function<List<String>, Object>> actions = Map.of("seen", args -> String.valueOf(args.get(0)));
        var vm = ReferenceMachine.of(program, actions, Map.of());

        assertEquals("null", runBalanced(vm, "a").value());
    }

    // === Diagnostics ===

    @Test
    void lastFailure_mapsBackToRule() throws ProgramGenerationException {
        var program = PegVm.generate(Grammar.of(
            Rule.of("Pair", sequence(ref("Digit"), literal(","), ref("Digit"))),
            Rule.of("Digit", "digit", charClass("[0-9]"))));
        var outcome = ReferenceMachine.of(program).run("1,x");

        assertFalse(outcome.matched());
        assertTrue(outcome.lastFailure() > 0);
        assertEquals("rule digit failed at instruction " + outcome.lastFailure(),
                     program.describeFailure(outcome.lastFailure()));
    }
}
