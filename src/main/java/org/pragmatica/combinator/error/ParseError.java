package org.pragmatica.combinator.error;

import org.pragmatica.combinator.tree.Span;
import org.pragmatica.lang.Cause;

/**
 * Syntax error: which rule failed, where, and why.
 *
 * @param expected label of the rule that was expected to match
 * @param span     location of the offending token
 * @param reason   human-readable reason
 */
public record ParseError(String expected, Span span, String reason) implements Cause {

    public static final String SYNTAX_ERROR = "Syntax error";
    public static final String UNEXPECTED_END_OF_INPUT = "Unexpected end of input";
    public static final String UNEXPECTED_TRAILING_INPUT = "Unexpected trailing input";
    public static final String INPUT_TOO_LARGE = "Input too large";

    public static ParseError syntaxError(String expected, Span span) {
        return new ParseError(expected, span, SYNTAX_ERROR);
    }

    public static ParseError endOfInput(String expected, Span span) {
        return new ParseError(expected, span, UNEXPECTED_END_OF_INPUT);
    }

    @Override
    public String message() {
        return "expected '" + expected + "' at " + span + ": " + reason;
    }
}
