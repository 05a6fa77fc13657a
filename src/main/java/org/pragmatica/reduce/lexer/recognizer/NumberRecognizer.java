package org.pragmatica.reduce.lexer.recognizer;

import org.pragmatica.reduce.lexer.LexerOutcome;
import org.pragmatica.reduce.lexer.Recognizer;

import java.util.function.LongFunction;

/**
 * Unsigned decimal integer literal. Signs are left to the grammar.
 */
public final class NumberRecognizer<T> implements Recognizer<T> {
    private final LongFunction<T> factory;

    public NumberRecognizer(LongFunction<T> factory) {
        this.factory = factory;
    }

    @Override
    public LexerOutcome<T> recognize(CharSequence input) {
        int length = CharClasses.digitRun(input, 0);
        if (length == 0) {
            return LexerOutcome.ignored();
        }
        var digits = input.subSequence(0, length)
                          .toString();
        try {
            return LexerOutcome.consumed(factory.apply(Long.parseLong(digits)), input, length);
        } catch (NumberFormatException e) {
            return LexerOutcome.failed("Number out of range: " + digits);
        }
    }
}
