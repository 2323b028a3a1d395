package org.pragmatica.combinator.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParseDataTest {

    private static final Token<String> A = Token.token("a", Span.at(1, 1, 1));
    private static final Token<String> B = Token.token("b", Span.at(1, 3, 3));
    private static final Token<String> C = Token.token("c", Span.at(2, 1, 4));

    @Test
    void width_countsLogicalItems() {
        assertEquals(1, ParseData.single(A).width());
        assertEquals(2, ParseData.tokenList(List.of(A, B)).width());
        assertEquals(2, ParseData.<String>nested(List.of(ParseData.single(A),
                                                         ParseData.tokenList(List.of(B, C)))).width());
    }

    @Test
    void firstSpan_findsLeftmostTokenInNestedData() {
        var data = ParseData.<String>nested(List.of(
            ParseData.nested(List.of()),
            ParseData.nested(List.of(ParseData.tokenList(List.of(B, C)))),
            ParseData.single(A)));

        assertEquals(B.span(), data.firstSpan().unwrap());
    }

    @Test
    void firstSpan_isEmptyWithoutTokens() {
        assertTrue(ParseData.<String>nested(List.of()).firstSpan().isEmpty());
        assertTrue(ParseData.<String>tokenList(List.of()).firstSpan().isEmpty());
        assertTrue(ParseData.<String>nested(List.of(ParseData.nested(List.of()))).firstSpan().isEmpty());
    }

    @Test
    void tokens_flattensTreeLeftToRight() {
        var data = ParseData.<String>nested(List.of(
            ParseData.single(A),
            ParseData.nested(List.of(ParseData.tokenList(List.of(B)), ParseData.single(C)))));

        assertThat(data.tokens()).containsExactly(A, B, C);
    }
}
