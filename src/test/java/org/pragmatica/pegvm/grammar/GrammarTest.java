package org.pragmatica.pegvm.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.pegvm.error.GenerationError;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.pegvm.grammar.Expression.*;

class GrammarTest {

    @Test
    void startRule_isFirstDeclared() {
        var grammar = Grammar.of(Rule.of("Expr", ref("Term")), Rule.of("Term", literal("t")));

        assertEquals("Expr", grammar.startRule().orElseThrow().name());
        assertTrue(Grammar.of().startRule().isEmpty());
    }

    @Test
    void ruleIndexMap_firstDeclarationWins() {
        var grammar = Grammar.of(Rule.of("A", literal("a")),
                                 Rule.of("B", literal("b")),
                                 Rule.of("A", literal("c")));

        assertEquals(Map.of("A", 0, "B", 1), grammar.ruleIndexMap());
        assertEquals("a", ((Expression.Literal) grammar.rule("A").orElseThrow().expression()).text());
    }

    @Test
    void validate_allReferencesDefined_succeeds() {
        var grammar = Grammar.of(Rule.of("List", sequence(ref("Item"), zeroOrMore(sequence(literal(","), ref("Item"))))),
                                 Rule.of("Item", action(labeled("v", charClass("[a-z]")), "v")));

        assertTrue(grammar.validate().isEmpty());
    }

    @Test
    void validate_nestedUndefinedReference_isReported() {
        var grammar = Grammar.of(Rule.of("A", literal("a")),
                                 Rule.of("B", choice(literal("x"), not(optional(labeled("l", ref("C")))))));

        var error = grammar.validate().orElseThrow();

        var undefined = assertInstanceOf(GenerationError.UndefinedRule.class, error);
        assertEquals("C", undefined.ruleName());
        assertEquals("B", undefined.referencingRule());
        assertTrue(error.message().startsWith("Undefined rule reference: 'C' in rule 'B'"));
    }

    @Test
    void rule_displayNameDefaultsToName() {
        assertEquals("Number", Rule.of("Number", any()).effectiveDisplayName());
        assertEquals("number", Rule.of("Number", "number", any()).effectiveDisplayName());
        assertFalse(Rule.of("Number", "Number", any()).hasDistinctDisplayName());
        assertTrue(Rule.of("Number", "number", any()).hasDistinctDisplayName());
    }

    @Test
    void grammar_copiesRuleList() {
        var rules = new ArrayList<Rule>();
        rules.add(Rule.of("A", literal("a")));
        var grammar = new Grammar(rules, Optional.empty());

        rules.clear();

        assertEquals(1, grammar.rules().size());
        assertThrows(UnsupportedOperationException.class, () -> grammar.rules().clear());
    }
}
