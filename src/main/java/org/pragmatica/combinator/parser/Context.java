package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.tree.Span;
import org.pragmatica.combinator.tree.Token;
import org.pragmatica.lang.Option;

import java.util.List;

/**
 * Read-only view over the token sequence of a single parse call.
 */
public final class Context<T> {

    private final List<Token<T>> tokens;

    private Context(List<Token<T>> tokens) {
        this.tokens = tokens;
    }

    public static <T> Context<T> create(List<Token<T>> tokens) {
        return new Context<>(List.copyOf(tokens));
    }

    public int size() {
        return tokens.size();
    }

    public boolean isAtEnd(int index) {
        return index >= tokens.size();
    }

    public Option<Token<T>> get(int index) {
        return index >= 0 && index < tokens.size()
            ? Option.some(tokens.get(index))
            : Option.none();
    }

    /**
     * Outcome for a token that was requested past the end of input:
     * absent when the rule is optional, an end-of-input error otherwise.
     */
    public ParseResult<T> endOfInput(String expected, boolean optional) {
        return optional
            ? ParseResult.none()
            : ParseResult.err(ParseError.endOfInput(expected, spanLast()));
    }

    /**
     * Span of the last token, or {@link Span#DEFAULT} for empty input.
     */
    public Span spanLast() {
        return tokens.isEmpty()
            ? Span.DEFAULT
            : tokens.get(tokens.size() - 1).span();
    }

    /**
     * Span of the token at the index, falling back to {@link #spanLast()} past the end.
     */
    public Span spanAt(int index) {
        var token = get(index);
        return token.isPresent()
            ? token.unwrap().span()
            : spanLast();
    }
}
