package org.pragmatica.combinator.parser.combinator;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.Context;
import org.pragmatica.combinator.parser.Parse;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.Parser;

import java.util.List;

/**
 * Ordered alternation: the first alternative that matches wins.
 *
 * <p>When every alternative fails, the individual errors are dropped in favour of a single
 * error carrying this rule's label, anchored at the last token of the input.
 * An optional choice reports {@link ParseResult.None} instead.
 */
public record Choice<T>(String label, boolean optional, List<Parser<T>> alternatives) implements Parser<T> {

    public Choice {
        alternatives = List.copyOf(alternatives);
    }

    @Override
    public Parse<T> parse(Context<T> context, int offset) {
        for (var alternative : alternatives) {
            var parse = alternative.parse(context, offset);

            if (parse.data().isOk()) {
                return parse;
            }
        }

        return optional
            ? Parse.at(label, ParseResult.none(), offset)
            : Parse.at(label, ParseResult.err(ParseError.syntaxError(label, context.spanLast())), offset);
    }
}
