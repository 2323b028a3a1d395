package org.pragmatica.combinator.parser.combinator;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.Context;
import org.pragmatica.combinator.parser.Parse;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.Parser;

import java.util.function.Supplier;

/**
 * Rule reference resolved at parse time, so that a rule can be used before it is defined.
 * This is what makes recursive grammars expressible. A reference that resolves to nothing
 * fails at the current token.
 */
public record Reference<T>(String label, Supplier<? extends Parser<T>> target) implements Parser<T> {

    @Override
    public Parse<T> parse(Context<T> context, int offset) {
        var resolved = target.get();
        if (resolved == null) {
            return Parse.at(label, ParseResult.err(ParseError.syntaxError(label, context.spanAt(offset))), offset);
        }
        return resolved.parse(context, offset);
    }
}
