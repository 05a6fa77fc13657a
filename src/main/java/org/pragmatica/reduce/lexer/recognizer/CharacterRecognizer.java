package org.pragmatica.reduce.lexer.recognizer;

import org.pragmatica.reduce.lexer.LexerOutcome;
import org.pragmatica.reduce.lexer.Recognizer;

import java.util.Map;

/**
 * Maps single characters (operators, punctuation, line breaks) to tokens.
 */
public final class CharacterRecognizer<T> implements Recognizer<T> {
    private final Map<Character, T> symbols;

    private CharacterRecognizer(Map<Character, T> symbols) {
        this.symbols = Map.copyOf(symbols);
    }

    public static <T> CharacterRecognizer<T> of(Map<Character, T> symbols) {
        return new CharacterRecognizer<>(symbols);
    }

    public static <T> CharacterRecognizer<T> of(char c, T token) {
        return new CharacterRecognizer<>(Map.of(c, token));
    }

    @Override
    public LexerOutcome<T> recognize(CharSequence input) {
        var token = symbols.get(input.charAt(0));
        return token == null
               ? LexerOutcome.ignored()
               : LexerOutcome.consumed(token, input, 1);
    }
}
