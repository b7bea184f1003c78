package org.pragmatica.pegvm.grammar;

import org.pragmatica.pegvm.tree.SourceSpan;

import java.util.Optional;

/**
 * A grammar rule: Name "display name" = Expression
 */
public record Rule(
 SourceSpan span,
 String name,
 Optional<String> displayName,
 Expression expression) {

    public static Rule of(String name, Expression expression) {
        return new Rule(SourceSpan.UNKNOWN, name, Optional.empty(), expression);
    }

    public static Rule of(String name, String displayName, Expression expression) {
        return new Rule(SourceSpan.UNKNOWN, name, Optional.of(displayName), expression);
    }

    /**
     * Name shown in diagnostics; the rule name when no display name is given.
     */
    public String effectiveDisplayName() {
        return displayName.orElse(name);
    }

    public boolean hasDistinctDisplayName() {
        return displayName.isPresent() && !displayName.get().equals(name);
    }
}
