package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.tree.ParseData;

/**
 * Outcome of one combinator invocation: matched, failed, or legitimately absent.
 */
public sealed interface ParseResult<T> {

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isErr() {
        return this instanceof Err;
    }

    default boolean isNone() {
        return this instanceof None;
    }

    static <T> ParseResult<T> ok(ParseData<T> data) {
        return new Ok<>(data);
    }

    static <T> ParseResult<T> err(ParseError error) {
        return new Err<>(error);
    }

    static <T> ParseResult<T> none() {
        return new None<>();
    }

    /**
     * Rule matched.
     */
    record Ok<T>(ParseData<T> data) implements ParseResult<T> {}

    /**
     * Rule was required here and did not match.
     */
    record Err<T>(ParseError error) implements ParseResult<T> {}

    /**
     * Optional rule matched zero times.
     */
    record None<T>() implements ParseResult<T> {}
}
