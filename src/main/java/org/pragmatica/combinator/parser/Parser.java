package org.pragmatica.combinator.parser;

/**
 * A grammar rule over tokens of type {@code T}.
 *
 * <p>Implementations must not mutate the context, must report {@code startOffset == offset},
 * and must leave {@code endOffset == startOffset} when they fail without consuming input.
 */
public interface Parser<T> {

    /**
     * Label used in errors produced by this rule.
     */
    String label();

    /**
     * Attempt to match this rule at the given offset.
     */
    Parse<T> parse(Context<T> context, int offset);
}
