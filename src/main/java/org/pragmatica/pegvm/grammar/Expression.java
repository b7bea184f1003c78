package org.pragmatica.pegvm.grammar;

import org.pragmatica.pegvm.tree.SourceSpan;

import java.util.List;

/**
 * PEG expression types - the building blocks of grammar rules.
 *
 * <p>Static factories build expressions without source positions, for grammars
 * assembled in code rather than read from text.
 */
public sealed interface Expression {

    /**
     * Source location of this expression in the grammar.
     */
    SourceSpan span();

    // === Terminals ===

    /**
     * Literal string match: 'text' or 'text'i
     */
    record Literal(SourceSpan span, String text, boolean caseInsensitive) implements Expression {}

    /**
     * Character class: [a-z], [^a-z], [a-z]i. The pattern keeps its brackets and flags.
     */
    record CharClass(SourceSpan span, String pattern) implements Expression {}

    /**
     * Any character: .
     */
    record AnyChar(SourceSpan span) implements Expression {}

    /**
     * Rule reference: RuleName
     */
    record RuleRef(SourceSpan span, String ruleName) implements Expression {}

    // === Combinators ===

    /**
     * Sequence: e1 e2 e3
     */
    record Sequence(SourceSpan span, List<Expression> elements) implements Expression {
        public Sequence {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Ordered choice: e1 / e2 / e3
     */
    record Choice(SourceSpan span, List<Expression> alternatives) implements Expression {
        public Choice {
            alternatives = List.copyOf(alternatives);
        }
    }

    // === Repetition ===

    /**
     * Zero or more: e*
     */
    record ZeroOrMore(SourceSpan span, Expression expression) implements Expression {}

    /**
     * One or more: e+
     */
    record OneOrMore(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Optional: e?
     */
    record Optional(SourceSpan span, Expression expression) implements Expression {}

    // === Predicates ===

    /**
     * Positive lookahead: &e
     */
    record AndPredicate(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Negative lookahead: !e
     */
    record NotPredicate(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Semantic predicate: &{ code }
     */
    record Predicate(SourceSpan span, String code) implements Expression {}

    // === Semantic values ===

    /**
     * Labeled expression: label:e - binds the matched text to label for enclosing code blocks
     */
    record Labeled(SourceSpan span, String label, Expression expression) implements Expression {}

    /**
     * Action: e { code }
     */
    record Action(SourceSpan span, Expression expression, String code) implements Expression {}

    // === Factories ===

    static Literal literal(String text) {
        return new Literal(SourceSpan.UNKNOWN, text, false);
    }

    static Literal literalIgnoreCase(String text) {
        return new Literal(SourceSpan.UNKNOWN, text, true);
    }

    static CharClass charClass(String pattern) {
        return new CharClass(SourceSpan.UNKNOWN, pattern);
    }

    static AnyChar any() {
        return new AnyChar(SourceSpan.UNKNOWN);
    }

    static RuleRef ref(String ruleName) {
        return new RuleRef(SourceSpan.UNKNOWN, ruleName);
    }

    static Sequence sequence(Expression... elements) {
        return new Sequence(SourceSpan.UNKNOWN, List.of(elements));
    }

    static Choice choice(Expression... alternatives) {
        return new Choice(SourceSpan.UNKNOWN, List.of(alternatives));
    }

    static ZeroOrMore zeroOrMore(Expression expression) {
        return new ZeroOrMore(SourceSpan.UNKNOWN, expression);
    }

    static OneOrMore oneOrMore(Expression expression) {
        return new OneOrMore(SourceSpan.UNKNOWN, expression);
    }

    static Optional optional(Expression expression) {
        return new Optional(SourceSpan.UNKNOWN, expression);
    }

    static AndPredicate and(Expression expression) {
        return new AndPredicate(SourceSpan.UNKNOWN, expression);
    }

    static NotPredicate not(Expression expression) {
        return new NotPredicate(SourceSpan.UNKNOWN, expression);
    }

    static Predicate predicate(String code) {
        return new Predicate(SourceSpan.UNKNOWN, code);
    }

    static Labeled labeled(String label, Expression expression) {
        return new Labeled(SourceSpan.UNKNOWN, label, expression);
    }

    static Action action(Expression expression, String code) {
        return new Action(SourceSpan.UNKNOWN, expression, code);
    }
}
