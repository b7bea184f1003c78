package org.pragmatica.pegvm.vm;

/**
 * Per-rule metadata kept in a program.
 *
 * @param nameIndex        string-table index of the rule name
 * @param displayNameIndex string-table index of the display name; equals {@code nameIndex} when none was given
 * @param entry            address of the first instruction of the rule
 */
public record RuleInfo(int nameIndex, int displayNameIndex, int entry) {}
