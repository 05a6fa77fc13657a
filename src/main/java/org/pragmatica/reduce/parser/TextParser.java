package org.pragmatica.reduce.parser;

import org.pragmatica.reduce.error.Diagnostic;
import org.pragmatica.reduce.error.ParseError;
import org.pragmatica.reduce.lexer.LexItem;
import org.pragmatica.reduce.lexer.Lexer;
import org.pragmatica.reduce.lexer.TokenStream;
import org.pragmatica.reduce.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lexer and grammar engine combined: parses text into a {@link ParseResult}.
 *
 * <p>Lexing and parsing are interleaved: the engine pulls one token at a time and the lexer
 * only recognizes a token when it is pulled. The first lexical error stops the pull.
 */
public final class TextParser<T> {
    private static final Logger log = LoggerFactory.getLogger(TextParser.class);

    private final Lexer<T> lexer;
    private final ShiftReduceEngine<T> engine;
    private final ParserConfig config;

    private TextParser(Lexer<T> lexer, ShiftReduceEngine<T> engine, ParserConfig config) {
        this.lexer = lexer;
        this.engine = engine;
        this.config = config;
    }

    public static <T> TextParser<T> create(Lexer<T> lexer, ShiftReduceEngine<T> engine, ParserConfig config) {
        return new TextParser<>(lexer, engine, config);
    }

    public Lexer<T> lexer() {
        return lexer;
    }

    public ShiftReduceEngine<T> engine() {
        return engine;
    }

    public ParserConfig config() {
        return config;
    }

    public ParseResult<T> parse(String text) {
        if (text.length() > config.maxInputLength()) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + config.maxInputLength() + " characters");
        }
        var feed = new TokenFeed<>(lexer.tokenize(text));
        var outcome = engine.reduce(feed);

        if (feed.error != null) {
            log.debug("Parse stopped by lexical error: {}", feed.error.message());
            return new ParseResult.Failure<>(feed.error);
        }
        if (outcome.isEmpty()) {
            return new ParseResult.Empty<>();
        }
        var tree = outcome.root()
                          .orElseThrow();
        if (outcome.isComplete()) {
            return ParseResult.Success.of(tree);
        }
        var end = feed.stream.location();
        int unreduced = outcome.unreduced()
                               .size();
        if (config.leftoverPolicy() == LeftoverPolicy.STRICT) {
            log.debug("Rejecting parse with {} unreduced element(s)", unreduced);
            return new ParseResult.Failure<>(new ParseError.UnreducedInput(end, unreduced));
        }
        var warning = Diagnostic.warning("W0001", "input did not reduce to a single tree", SourceSpan.at(end))
                                .withLabel(unreduced + " element(s) below the result were left unreduced");
        return new ParseResult.Success<>(tree, outcome.unreduced(), List.of(warning));
    }

    /**
     * Token values of a {@link TokenStream}, ending at the first error, which is kept aside.
     */
    private static final class TokenFeed<T> implements Iterator<T> {
        private final TokenStream<T> stream;
        private ParseError error;
        private LexItem.Token<T> pending;

        private TokenFeed(TokenStream<T> stream) {
            this.stream = stream;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (error != null || !stream.hasNext()) {
                return false;
            }
            var item = stream.next();
            if (item instanceof LexItem.Error<T> failure) {
                error = failure.error();
                return false;
            }
            pending = (LexItem.Token<T>) item;
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var value = pending.value();
            pending = null;
            return value;
        }
    }
}
