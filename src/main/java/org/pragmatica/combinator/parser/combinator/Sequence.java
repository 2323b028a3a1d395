package org.pragmatica.combinator.parser.combinator;

import org.pragmatica.combinator.parser.Context;
import org.pragmatica.combinator.parser.Parse;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.tree.ParseData;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered conjunction: every child must match, one after another.
 *
 * <p>Children reporting {@link ParseResult.None} are skipped. The first child error
 * fails the whole sequence; an optional sequence reports it as {@link ParseResult.None}
 * so an enclosing rule can try something else. In both cases {@code endOffset}
 * records how far the sequence got.
 */
public record Sequence<T>(String label, boolean optional, List<Parser<T>> children) implements Parser<T> {

    public Sequence {
        children = List.copyOf(children);
    }

    @Override
    public Parse<T> parse(Context<T> context, int offset) {
        var cursor = offset;
        var matched = new ArrayList<ParseData<T>>();

        for (var child : children) {
            var parse = child.parse(context, cursor);

            if (parse.data() instanceof ParseResult.Ok<T> ok) {
                cursor += parse.size();
                matched.add(ok.data());
            } else if (parse.data().isErr()) {
                return optional
                    ? Parse.of(label, ParseResult.none(), offset, cursor)
                    : Parse.of(label, parse.data(), offset, cursor);
            }
        }
        return Parse.of(label, ParseResult.ok(ParseData.nested(matched)), offset, cursor);
    }
}
