package org.pragmatica.combinator.parser;

/**
 * Parser configuration options.
 *
 * @param maxTokens              largest accepted input, in tokens
 * @param requireFullConsumption fail when a successful parse leaves tokens unconsumed
 */
public record ParserConfig(
    int maxTokens,
    boolean requireFullConsumption
) {
    public static final int UNLIMITED = Integer.MAX_VALUE;

    public static final ParserConfig DEFAULT = new ParserConfig(
        UNLIMITED,
        false
    );

    public ParserConfig {
        if (maxTokens < 0) {
            throw new IllegalArgumentException("maxTokens must not be negative: " + maxTokens);
        }
    }
}
