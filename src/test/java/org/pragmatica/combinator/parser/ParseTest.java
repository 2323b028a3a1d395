package org.pragmatica.combinator.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParseTest {

    @Test
    void size_isDistanceBetweenOffsets() {
        var parse = Parse.<String>of("rule", ParseResult.none(), 2, 5);

        assertEquals(3, parse.size());
    }

    @Test
    void at_isZeroWidth() {
        var parse = Parse.<String>at("rule", ParseResult.none(), 4);

        assertEquals(4, parse.startOffset());
        assertEquals(4, parse.endOffset());
        assertEquals(0, parse.size());
    }

    @Test
    void endBeforeStart_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Parse.<String>of("rule", ParseResult.none(), 3, 2));
    }

    @Test
    void resultPredicates_matchVariant() {
        assertTrue(ParseResult.<String>none().isNone());
        assertFalse(ParseResult.<String>none().isOk());
        assertFalse(ParseResult.<String>none().isErr());
    }
}
