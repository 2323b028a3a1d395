package org.pragmatica.combinator.parser.combinator;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.Context;
import org.pragmatica.combinator.parser.Parse;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.tree.ParseData;

import java.util.ArrayList;

/**
 * Greedy repetition of {@code child}, one or more times ({@code optional} makes it zero or more).
 *
 * <p>Once at least one iteration matched, whatever stopped the loop is discarded.
 * An iteration that consumes nothing ends the loop.
 */
public record Repeatable<T>(String label, boolean optional, Parser<T> child) implements Parser<T> {

    @Override
    public Parse<T> parse(Context<T> context, int offset) {
        var cursor = offset;
        var items = new ArrayList<ParseData<T>>();
        ParseResult<T> stoppedBy = ParseResult.none();

        while (true) {
            var parse = child.parse(context, cursor);

            if (!(parse.data() instanceof ParseResult.Ok<T> ok)) {
                stoppedBy = parse.data();
                break;
            }

            items.add(ok.data());
            cursor += parse.size();

            if (parse.size() == 0) {
                break;
            }
        }

        if (!items.isEmpty()) {
            return Parse.of(label, ParseResult.ok(ParseData.nested(items)), offset, cursor);
        }
        if (optional) {
            return Parse.of(label, ParseResult.none(), offset, cursor);
        }
        if (stoppedBy.isErr()) {
            return Parse.of(label, stoppedBy, offset, cursor);
        }
        return Parse.of(label, ParseResult.err(ParseError.syntaxError(label, context.spanAt(cursor))), offset, cursor);
    }
}
