package org.pragmatica.pegvm.grammar;

import org.pragmatica.pegvm.error.GenerationError;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A complete PEG grammar - ordered rules plus an optional initializer code block.
 * The first rule is the entry point.
 */
public record Grammar(
 List<Rule> rules,
 Optional<String> init) {

    public Grammar {
        rules = List.copyOf(rules);
    }

    public static Grammar of(Rule... rules) {
        return new Grammar(List.of(rules), Optional.empty());
    }

    public Grammar withInit(String code) {
        return new Grammar(rules, Optional.of(code));
    }

    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .equals(name))
                    .findFirst();
    }

    /**
     * Get the entry rule (always the first declared one).
     */
    public Optional<Rule> startRule() {
        return rules.isEmpty()
               ? Optional.empty()
               : Optional.of(rules.get(0));
    }

    /**
     * Build a lookup map from rule name to declaration index. The first declaration wins on duplicates.
     */
    public Map<String, Integer> ruleIndexMap() {
        var map = new HashMap<String, Integer>();
        for (int i = 0; i < rules.size(); i++) {
            map.putIfAbsent(rules.get(i).name(), i);
        }
        return map;
    }

    /**
     * Validate the grammar for undefined references.
     *
     * @return the first problem found, or empty when every reference resolves
     */
    public Optional<GenerationError> validate() {
        var ruleNames = rules.stream()
                             .map(Rule::name)
                             .collect(Collectors.toSet());
        for (var rule : rules) {
            var undefinedRef = findUndefinedReference(rule.expression(), ruleNames);
            if (undefinedRef.isPresent()) {
                var ref = undefinedRef.get();
                return Optional.of(new GenerationError.UndefinedRule(ref.span(), ref.ruleName(), rule.name()));
            }
        }
        return Optional.empty();
    }

    /**
     * Recursively find the first undefined rule reference in an expression.
     */
    private Optional<Expression.RuleRef> findUndefinedReference(Expression expr, Set<String> ruleNames) {
        if (expr instanceof Expression.RuleRef ref) {
            return ruleNames.contains(ref.ruleName())
                   ? Optional.empty()
                   : Optional.of(ref);
        }
        if (expr instanceof Expression.Sequence seq) {
            return firstUndefined(seq.elements(), ruleNames);
        }
        if (expr instanceof Expression.Choice choice) {
            return firstUndefined(choice.alternatives(), ruleNames);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return findUndefinedReference(zom.expression(), ruleNames);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return findUndefinedReference(oom.expression(), ruleNames);
        }
        if (expr instanceof Expression.Optional opt) {
            return findUndefinedReference(opt.expression(), ruleNames);
        }
        if (expr instanceof Expression.AndPredicate and) {
            return findUndefinedReference(and.expression(), ruleNames);
        }
        if (expr instanceof Expression.NotPredicate not) {
            return findUndefinedReference(not.expression(), ruleNames);
        }
        if (expr instanceof Expression.Labeled labeled) {
            return findUndefinedReference(labeled.expression(), ruleNames);
        }
        if (expr instanceof Expression.Action action) {
            return findUndefinedReference(action.expression(), ruleNames);
        }
        // Terminals and semantic predicates - no nested expressions
        return Optional.empty();
    }

    private Optional<Expression.RuleRef> firstUndefined(List<Expression> expressions, Set<String> ruleNames) {
        return expressions.stream()
                          .map(e -> findUndefinedReference(e, ruleNames))
                          .filter(Optional::isPresent)
                          .map(Optional::get)
                          .findFirst();
    }
}
