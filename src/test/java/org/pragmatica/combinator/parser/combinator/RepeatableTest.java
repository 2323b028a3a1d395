package org.pragmatica.combinator.parser.combinator;

import org.junit.jupiter.api.Test;
import org.pragmatica.combinator.examples.TokenType;
import org.pragmatica.combinator.parser.Context;
import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.tree.ParseData;
import org.pragmatica.combinator.tree.Span;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.combinator.examples.Tokens.*;

class RepeatableTest {

    private static final Parser<TokenType> ID = new Predicate<TokenType>("id", false, type -> type instanceof TokenType.Id);
    private static final Parser<TokenType> ITEM = new Sequence<TokenType>("item", false, List.of(
        ID,
        new OfType<TokenType>("=", false, TokenType.EQUALS),
        new Predicate<TokenType>("value", false, type -> type instanceof TokenType.Str)));

    @Test
    void neverMatching_optional_isNoneWithoutConsumption() {
        var ctx = Context.create(line(TokenType.SEMICOLON));

        var parse = new Repeatable<TokenType>("ids", true, ID).parse(ctx, 0);

        assertTrue(parse.data().isNone());
        assertEquals(0, parse.size());
    }

    @Test
    void neverMatching_mandatory_propagatesChildError() {
        var ctx = Context.create(line(TokenType.SEMICOLON));

        var parse = new Repeatable<TokenType>("ids", false, ID).parse(ctx, 0);

        var error = ((ParseResult.Err<TokenType>) parse.data()).error();
        assertEquals("id", error.expected());
        assertEquals(0, parse.size());
    }

    @Test
    void matchingKTimes_collectsKItemsAndDiscardsTrailingError() {
        var ctx = Context.create(line(id("a"), id("b"), id("c"), TokenType.SEMICOLON));

        var parse = new Repeatable<TokenType>("ids", false, ID).parse(ctx, 0);

        var nested = (ParseData.Nested<TokenType>) ((ParseResult.Ok<TokenType>) parse.data()).data();
        assertEquals(3, nested.children().size());
        assertEquals(3, parse.size());
    }

    @Test
    void structuredChild_advancesByEachIterationSize() {
        var ctx = Context.create(line(id("a"), TokenType.EQUALS, str("x"),
                                      id("b"), TokenType.EQUALS, str("y"),
                                      TokenType.EOI));

        var parse = new Repeatable<TokenType>("fields", true, ITEM).parse(ctx, 0);

        var nested = (ParseData.Nested<TokenType>) ((ParseResult.Ok<TokenType>) parse.data()).data();
        assertEquals(2, nested.children().size());
        assertEquals(6, parse.endOffset());
    }

    @Test
    void partialTrailingItem_isDiscarded() {
        var ctx = Context.create(line(id("a"), TokenType.EQUALS, str("x"), id("b"), TokenType.EQUALS));

        var parse = new Repeatable<TokenType>("fields", false, ITEM).parse(ctx, 0);

        assertTrue(parse.data().isOk());
        assertEquals(3, parse.endOffset());
    }

    @Test
    void childEndingWithNone_atEndOfInput_mandatory_reportsErrorAtLastToken() {
        var ctx = Context.create(line(id("a")));
        var optionalSemicolon = new OfType<TokenType>(";", true, TokenType.SEMICOLON);

        var parse = new Repeatable<TokenType>("semicolons", false, optionalSemicolon).parse(ctx, 1);

        var error = ((ParseResult.Err<TokenType>) parse.data()).error();
        assertEquals("semicolons", error.expected());
        assertEquals(Span.at(1, 1, 1), error.span());
    }

    @Test
    void childEndingWithNone_emptyInput_reportsDefaultSpan() {
        var optionalSemicolon = new OfType<TokenType>(";", true, TokenType.SEMICOLON);

        var parse = new Repeatable<TokenType>("semicolons", false, optionalSemicolon).parse(Context.create(List.of()), 0);

        assertEquals(Span.DEFAULT, ((ParseResult.Err<TokenType>) parse.data()).error().span());
    }

    @Test
    void zeroWidthChild_terminates() {
        var ctx = Context.create(line(id("a")));
        var nothing = new Sequence<TokenType>("nothing", false, List.of(new OfType<TokenType>(";", true, TokenType.SEMICOLON)));

        var parse = new Repeatable<TokenType>("loop", false, nothing).parse(ctx, 1);

        var nested = (ParseData.Nested<TokenType>) ((ParseResult.Ok<TokenType>) parse.data()).data();
        assertEquals(1, nested.children().size());
        assertEquals(0, parse.size());
    }
}
