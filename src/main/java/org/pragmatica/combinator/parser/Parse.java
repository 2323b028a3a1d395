package org.pragmatica.combinator.parser;

/**
 * Full outcome of one combinator invocation, including the cursor range it covered.
 *
 * @param typeParsed  label of the rule that produced this outcome
 * @param data        matched, failed, or absent
 * @param startOffset offset the combinator was invoked at
 * @param endOffset   cursor after the combinator returned
 */
public record Parse<T>(String typeParsed, ParseResult<T> data, int startOffset, int endOffset) {

    public Parse {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid offsets " + startOffset + ".." + endOffset);
        }
    }

    public static <T> Parse<T> of(String typeParsed, ParseResult<T> data, int startOffset, int endOffset) {
        return new Parse<>(typeParsed, data, startOffset, endOffset);
    }

    /**
     * Zero-width outcome at the given offset.
     */
    public static <T> Parse<T> at(String typeParsed, ParseResult<T> data, int offset) {
        return new Parse<>(typeParsed, data, offset, offset);
    }

    /**
     * Number of token positions consumed.
     */
    public int size() {
        return endOffset - startOffset;
    }
}
