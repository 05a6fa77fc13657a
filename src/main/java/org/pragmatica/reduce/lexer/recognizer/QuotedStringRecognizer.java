package org.pragmatica.reduce.lexer.recognizer;

import org.pragmatica.reduce.lexer.LexerOutcome;
import org.pragmatica.reduce.lexer.Recognizer;

import java.util.function.Function;

/**
 * Quoted string literal on a single line, without escapes. The token receives the text between
 * the quotes. A literal that reaches a line break or the end of input before its closing quote
 * is reported as malformed.
 */
public final class QuotedStringRecognizer<T> implements Recognizer<T> {
    private final char quote;
    private final Function<String, T> factory;

    public QuotedStringRecognizer(Function<String, T> factory) {
        this('"', factory);
    }

    public QuotedStringRecognizer(char quote, Function<String, T> factory) {
        this.quote = quote;
        this.factory = factory;
    }

    @Override
    public LexerOutcome<T> recognize(CharSequence input) {
        if (input.charAt(0) != quote) {
            return LexerOutcome.ignored();
        }
        for (int pos = 1; pos < input.length(); pos++) {
            char c = input.charAt(pos);
            if (c == quote) {
                return LexerOutcome.consumed(factory.apply(input.subSequence(1, pos)
                                                                .toString()),
                                             input,
                                             pos + 1);
            }
            if (c == '\n') {
                break;
            }
        }
        return LexerOutcome.failed("Unterminated string literal");
    }
}
