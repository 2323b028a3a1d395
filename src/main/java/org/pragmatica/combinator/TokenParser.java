package org.pragmatica.combinator;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.Context;
import org.pragmatica.combinator.parser.Parse;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.parser.ParserConfig;
import org.pragmatica.combinator.tree.ParseData;
import org.pragmatica.combinator.tree.Token;
import org.pragmatica.lang.Option;
import org.pragmatica.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for running a grammar over a token sequence.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = TokenParser.create(document);
 *
 * var result = parser.parse(tokens);
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class TokenParser<T> {
    private static final Logger log = LoggerFactory.getLogger(TokenParser.class);

    private final Parser<T> root;
    private final ParserConfig config;

    private TokenParser(Parser<T> root, ParserConfig config) {
        this.root = root;
        this.config = config;
    }

    public static <T> TokenParser<T> create(Parser<T> root) {
        return create(root, ParserConfig.DEFAULT);
    }

    public static <T> TokenParser<T> create(Parser<T> root, ParserConfig config) {
        return new TokenParser<>(root, config);
    }

    public static <T> Builder<T> builder(Parser<T> root) {
        return new Builder<>(root);
    }

    public Parser<T> root() {
        return root;
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Run the root rule at offset 0 and return its outcome as is.
     */
    public Parse<T> parseRaw(List<Token<T>> tokens) {
        return root.parse(Context.create(tokens), 0);
    }

    /**
     * Parse the whole token sequence.
     *
     * @return the parse tree, an empty option when the root rule is optional and did not match,
     *         or a {@link ParseError} on failure
     */
    public Result<Option<ParseData<T>>> parse(List<Token<T>> tokens) {
        var context = Context.create(tokens);

        if (context.size() > config.maxTokens()) {
            log.debug("Rejecting input of {} tokens, limit is {}", context.size(), config.maxTokens());
            return Result.failure(new ParseError(root.label(), context.spanAt(config.maxTokens()),
                                                 ParseError.INPUT_TOO_LARGE));
        }

        log.debug("Parsing {} tokens with rule '{}'", context.size(), root.label());
        var parse = root.parse(context, 0);
        var data = parse.data();

        if (data instanceof ParseResult.Err<T> err) {
            log.debug("Rule '{}' failed: {}", parse.typeParsed(), err.error().message());
            return Result.failure(err.error());
        }

        // An absent root contributes no tree, so whatever it walked over is still unconsumed
        var consumedUpTo = data.isOk()
            ? parse.endOffset()
            : parse.startOffset();

        if (config.requireFullConsumption() && !context.isAtEnd(consumedUpTo)) {
            var error = new ParseError(root.label(), context.spanAt(consumedUpTo),
                                       ParseError.UNEXPECTED_TRAILING_INPUT);
            log.debug("Rule '{}' stopped at offset {} of {}", parse.typeParsed(), consumedUpTo, context.size());
            return Result.failure(error);
        }

        log.debug("Rule '{}' consumed {} tokens", parse.typeParsed(), consumedUpTo - parse.startOffset());
        Option<ParseData<T>> tree = data instanceof ParseResult.Ok<T> ok
            ? Option.some(ok.data())
            : Option.none();
        return Result.success(tree);
    }

    public static final class Builder<T> {
        private final Parser<T> root;
        private int maxTokens = ParserConfig.UNLIMITED;
        private boolean requireFullConsumption = false;

        private Builder(Parser<T> root) {
            this.root = root;
        }

        public Builder<T> maxTokens(int limit) {
            this.maxTokens = limit;
            return this;
        }

        public Builder<T> requireFullConsumption(boolean required) {
            this.requireFullConsumption = required;
            return this;
        }

        public TokenParser<T> build() {
            return create(root, new ParserConfig(maxTokens, requireFullConsumption));
        }
    }
}
