package org.pragmatica.reduce.lexer;

/**
 * A single lexical rule that may claim, ignore or reject the input at the current position.
 *
 * <p>Implementations must be total: for every non-empty input they return one of the three
 * {@link LexerOutcome} variants and never throw. A recognizer only ever sees the input starting
 * at the current position; a successful outcome returns the unconsumed remainder, which must be
 * a strictly shorter suffix of the input.
 *
 * @param <T> token type
 */
@FunctionalInterface
public interface Recognizer<T> {

    /**
     * Try to recognize a token at the start of {@code input}.
     *
     * @param input remaining input, never empty
     */
    LexerOutcome<T> recognize(CharSequence input);

    /**
     * Name used in diagnostics.
     */
    default String name() {
        var simpleName = getClass().getSimpleName();
        return simpleName.contains("$$Lambda") || simpleName.isEmpty()
               ? "recognizer"
               : simpleName;
    }

    /**
     * Same recognizer reported under the given name.
     */
    static <T> Recognizer<T> named(String name, Recognizer<T> recognizer) {
        return new Recognizer<>() {
            @Override
            public LexerOutcome<T> recognize(CharSequence input) {
                return recognizer.recognize(input);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
