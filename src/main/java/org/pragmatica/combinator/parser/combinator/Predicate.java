package org.pragmatica.combinator.parser.combinator;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.Context;
import org.pragmatica.combinator.parser.Parse;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.tree.ParseData;

/**
 * Matches exactly one token whose type satisfies {@code test}, e.g. "any identifier".
 * A mismatch is reported zero-width, same as {@link OfType}.
 */
public record Predicate<T>(String label, boolean optional, java.util.function.Predicate<? super T> test)
    implements Parser<T> {

    @Override
    public Parse<T> parse(Context<T> context, int offset) {
        var token = context.get(offset);
        if (token.isEmpty()) {
            return Parse.at(label, context.endOfInput(label, optional), offset);
        }

        var matched = token.unwrap();
        if (test.test(matched.type())) {
            return Parse.of(label, ParseResult.ok(ParseData.single(matched)), offset, offset + 1);
        }
        return Parse.at(label, ParseResult.err(ParseError.syntaxError(label, matched.span())), offset);
    }
}
