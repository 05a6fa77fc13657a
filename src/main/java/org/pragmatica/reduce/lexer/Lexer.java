package org.pragmatica.reduce.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered chain of {@link Recognizer}s turning text into a lazy {@link TokenStream}.
 *
 * <p>Recognizer order is significant: at each position the first recognizer that does not ignore
 * the input decides the outcome. A recognizer for a closed keyword set therefore has to come
 * before a generic identifier recognizer that would claim the same characters.
 *
 * <p>Example usage:
 * <pre>{@code
 * var lexer = Lexer.<Token>builder()
 *                  .add(new QuotedStringRecognizer<>('"', Token::string))
 *                  .add(KeywordRecognizer.of(Keyword.class, Token::keyword))
 *                  .add(new NumberRecognizer<>(Token::number))
 *                  .build();
 *
 * lexer.tokenize("10 PRINT \"hi\"").forEachRemaining(System.out::println);
 * }</pre>
 *
 * @param <T> token type
 */
public final class Lexer<T> {
    private final List<Recognizer<T>> recognizers;

    private Lexer(List<Recognizer<T>> recognizers) {
        this.recognizers = List.copyOf(recognizers);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public List<Recognizer<T>> recognizers() {
        return recognizers;
    }

    /**
     * Start lexing {@code input}. Nothing is recognized until the stream is pulled.
     */
    public TokenStream<T> tokenize(String input) {
        return new TokenStream<>(recognizers, Objects.requireNonNull(input, "input"));
    }

    public static final class Builder<T> {
        private final List<Recognizer<T>> recognizers = new ArrayList<>();

        private Builder() {}

        public Builder<T> add(Recognizer<T> recognizer) {
            recognizers.add(Objects.requireNonNull(recognizer, "recognizer"));
            return this;
        }

        /**
         * Append recognizers after the ones already added, keeping their order.
         */
        public Builder<T> addAll(List<? extends Recognizer<T>> list) {
            list.forEach(this::add);
            return this;
        }

        public Lexer<T> build() {
            return new Lexer<>(recognizers);
        }
    }
}
