package org.pragmatica.reduce;

import org.pragmatica.reduce.grammar.Grammar;
import org.pragmatica.reduce.lexer.Lexer;
import org.pragmatica.reduce.parser.LeftoverPolicy;
import org.pragmatica.reduce.parser.Parser;
import org.pragmatica.reduce.parser.ParserConfig;
import org.pragmatica.reduce.parser.ShiftReduceEngine;
import org.pragmatica.reduce.parser.TextParser;

import java.util.Objects;

/**
 * Entry point for creating shift-reduce parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = ReduceParser.builder(lexer, grammar)
 *                          .leftover(LeftoverPolicy.STRICT)
 *                          .build();
 *
 * var result = parser.parse("10 IF A <= 5 THEN GOTO 40");
 * }</pre>
 */
public final class ReduceParser {
    private ReduceParser() {}

    /**
     * Create a token-level parser for a grammar.
     */
    public static <T> Parser<T> fromGrammar(Grammar<T> grammar) {
        return ShiftReduceEngine.create(grammar);
    }

    /**
     * Create a text parser with the default configuration.
     */
    public static <T> TextParser<T> pipeline(Lexer<T> lexer, Grammar<T> grammar) {
        return pipeline(lexer, grammar, ParserConfig.DEFAULT);
    }

    /**
     * Create a text parser with custom configuration.
     */
    public static <T> TextParser<T> pipeline(Lexer<T> lexer, Grammar<T> grammar, ParserConfig config) {
        Objects.requireNonNull(lexer, "lexer");
        Objects.requireNonNull(config, "config");
        return TextParser.create(lexer, ShiftReduceEngine.create(grammar), config);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static <T> Builder<T> builder(Lexer<T> lexer, Grammar<T> grammar) {
        return new Builder<>(lexer, grammar);
    }

    public static final class Builder<T> {
        private final Lexer<T> lexer;
        private final Grammar<T> grammar;
        private LeftoverPolicy leftoverPolicy = ParserConfig.DEFAULT.leftoverPolicy();
        private int maxInputLength = ParserConfig.DEFAULT.maxInputLength();

        private Builder(Lexer<T> lexer, Grammar<T> grammar) {
            this.lexer = lexer;
            this.grammar = grammar;
        }

        public Builder<T> leftover(LeftoverPolicy policy) {
            this.leftoverPolicy = policy;
            return this;
        }

        public Builder<T> strict() {
            return leftover(LeftoverPolicy.STRICT);
        }

        public Builder<T> maxInputLength(int length) {
            this.maxInputLength = length;
            return this;
        }

        public TextParser<T> build() {
            var config = new ParserConfig(leftoverPolicy, maxInputLength);
            return pipeline(lexer, grammar, config);
        }
    }
}
