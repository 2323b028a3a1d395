package org.pragmatica.combinator.parser.combinator;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.Context;
import org.pragmatica.combinator.parser.Parse;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.Parser;

/**
 * Negative lookahead: succeeds with {@link ParseResult.None} when {@code child} does not match.
 * Never produces data and never consumes input.
 */
public record Not<T>(String label, boolean optional, Parser<T> child) implements Parser<T> {

    @Override
    public Parse<T> parse(Context<T> context, int offset) {
        var parse = child.parse(context, offset);

        if (!(parse.data() instanceof ParseResult.Ok<T> ok) || optional) {
            return Parse.at(label, ParseResult.none(), offset);
        }

        // Matched data without tokens (e.g. a sequence of absent optionals) points at the offset itself
        var firstSpan = ok.data().firstSpan();
        var span = firstSpan.isPresent()
            ? firstSpan.unwrap()
            : context.spanAt(offset);
        return Parse.at(label, ParseResult.err(ParseError.syntaxError(label, span)), offset);
    }
}
