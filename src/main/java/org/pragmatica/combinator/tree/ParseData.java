package org.pragmatica.combinator.tree;

import org.pragmatica.lang.Option;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-shaped payload of a successful parse.
 */
public sealed interface ParseData<T> {

    /**
     * Number of logical items this payload represents.
     */
    int width();

    /**
     * Span of the leftmost token in this payload, if it holds any.
     */
    Option<Span> firstSpan();

    /**
     * All matched tokens, left to right.
     */
    default List<Token<T>> tokens() {
        var result = new ArrayList<Token<T>>();
        collectTokens(this, result);
        return List.copyOf(result);
    }

    static <T> ParseData<T> nested(List<ParseData<T>> children) {
        return new Nested<>(children);
    }

    static <T> ParseData<T> tokenList(List<Token<T>> tokens) {
        return new TokenList<>(tokens);
    }

    static <T> ParseData<T> single(Token<T> token) {
        return new Single<>(token);
    }

    /**
     * Output of a structural combinator, children in order.
     */
    record Nested<T>(List<ParseData<T>> children) implements ParseData<T> {
        public Nested {
            children = List.copyOf(children);
        }

        @Override
        public int width() {
            return children.size();
        }

        @Override
        public Option<Span> firstSpan() {
            for (var child : children) {
                var span = child.firstSpan();
                if (span.isPresent()) {
                    return span;
                }
            }
            return Option.none();
        }
    }

    /**
     * Flat list of tokens collapsed into one item.
     */
    record TokenList<T>(List<Token<T>> tokens) implements ParseData<T> {
        public TokenList {
            tokens = List.copyOf(tokens);
        }

        @Override
        public int width() {
            return tokens.size();
        }

        @Override
        public Option<Span> firstSpan() {
            return tokens.isEmpty()
                ? Option.none()
                : Option.some(tokens.get(0).span());
        }
    }

    /**
     * A single matched token.
     */
    record Single<T>(Token<T> token) implements ParseData<T> {
        @Override
        public int width() {
            return 1;
        }

        @Override
        public Option<Span> firstSpan() {
            return Option.some(token.span());
        }
    }

    private static <T> void collectTokens(ParseData<T> data, List<Token<T>> sink) {
        if (data instanceof Single<T> single) {
            sink.add(single.token());
        } else if (data instanceof TokenList<T> list) {
            sink.addAll(list.tokens());
        } else if (data instanceof Nested<T> nested) {
            nested.children().forEach(child -> collectTokens(child, sink));
        }
    }
}
