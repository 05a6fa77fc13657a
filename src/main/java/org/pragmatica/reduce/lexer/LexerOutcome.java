package org.pragmatica.reduce.lexer;

/**
 * Result of applying one {@link Recognizer} at one input position.
 *
 * @param <T> token type
 */
public sealed interface LexerOutcome<T> {

    static <T> LexerOutcome<T> success(T token, CharSequence remainder) {
        return new Success<>(token, remainder);
    }

    /**
     * Success after consuming the first {@code consumed} characters of {@code input}.
     */
    static <T> LexerOutcome<T> consumed(T token, CharSequence input, int consumed) {
        return new Success<>(token, input.subSequence(consumed, input.length()));
    }

    static <T> LexerOutcome<T> ignored() {
        return new Ignored<>();
    }

    static <T> LexerOutcome<T> failed(String reason) {
        return new Failed<>(reason);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isIgnored() {
        return this instanceof Ignored;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * The recognizer produced a token; {@code remainder} is the input left after it.
     */
    record Success<T>(T token, CharSequence remainder) implements LexerOutcome<T> {}

    /**
     * The recognizer does not claim the current position.
     */
    record Ignored<T>() implements LexerOutcome<T> {}

    /**
     * The recognizer claims the current position but the input is malformed.
     */
    record Failed<T>(String reason) implements LexerOutcome<T> {}
}
