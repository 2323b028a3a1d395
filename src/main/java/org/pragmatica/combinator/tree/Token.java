package org.pragmatica.combinator.tree;

/**
 * A lexical unit produced by an external lexer.
 *
 * @param type token type, compared by value
 * @param span source location of the token
 * @param <T>  caller-defined token type
 */
public record Token<T>(T type, Span span) {

    public static <T> Token<T> token(T type, Span span) {
        return new Token<>(type, span);
    }

    public int spanSize() {
        return span.width();
    }
}
