package org.pragmatica.reduce.lexer.recognizer;

import org.pragmatica.reduce.lexer.LexerOutcome;
import org.pragmatica.reduce.lexer.Recognizer;

import java.util.function.Function;

/**
 * Generic identifier: an ASCII letter followed by letters or digits, at most {@code maxLength}
 * characters. Longer words are split, so with {@code maxLength == 1} {@code "AB"} yields two tokens.
 */
public final class WordRecognizer<T> implements Recognizer<T> {
    private final int maxLength;
    private final Function<String, T> factory;

    public WordRecognizer(Function<String, T> factory) {
        this(Integer.MAX_VALUE, factory);
    }

    public WordRecognizer(int maxLength, Function<String, T> factory) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive, got " + maxLength);
        }
        this.maxLength = maxLength;
        this.factory = factory;
    }

    @Override
    public LexerOutcome<T> recognize(CharSequence input) {
        if (!CharClasses.isLetter(input.charAt(0))) {
            return LexerOutcome.ignored();
        }
        int length = 1;
        while (length < maxLength && length < input.length()
               && (CharClasses.isLetter(input.charAt(length)) || CharClasses.isDigit(input.charAt(length)))) {
            length++;
        }
        return LexerOutcome.consumed(factory.apply(input.subSequence(0, length)
                                                        .toString()),
                                     input,
                                     length);
    }
}
