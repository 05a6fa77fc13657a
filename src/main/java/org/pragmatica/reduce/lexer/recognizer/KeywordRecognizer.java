package org.pragmatica.reduce.lexer.recognizer;

import org.pragmatica.reduce.lexer.LexerOutcome;
import org.pragmatica.reduce.lexer.Recognizer;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Recognizes a closed set of keywords, case-insensitively.
 *
 * <p>The leading run of ASCII letters is compared against the keyword set as a whole word:
 * {@code "CLEAR"} and {@code "clear\n"} match the keyword {@code CLEAR}, {@code "CLEARS"} does not.
 * Must be placed before any recognizer that would consume the same letters as an identifier.
 */
public final class KeywordRecognizer<T> implements Recognizer<T> {
    private final Map<String, T> keywords;

    private KeywordRecognizer(Map<String, T> keywords) {
        this.keywords = Map.copyOf(keywords);
    }

    /**
     * Recognizer for the given spellings. Keys are matched case-insensitively, so two keys that
     * differ only in case are rejected.
     */
    public static <T> KeywordRecognizer<T> of(Map<String, T> keywords) {
        var normalized = new HashMap<String, T>();
        keywords.forEach((word, token) -> register(normalized, word, token));
        return new KeywordRecognizer<>(normalized);
    }

    /**
     * Recognizer for every constant of {@code type}, spelled as the constant name.
     */
    public static <E extends Enum<E>, T> KeywordRecognizer<T> of(Class<E> type, Function<E, T> factory) {
        var normalized = new HashMap<String, T>();
        for (var constant : type.getEnumConstants()) {
            register(normalized, constant.name(), factory.apply(constant));
        }
        return new KeywordRecognizer<>(normalized);
    }

    @Override
    public LexerOutcome<T> recognize(CharSequence input) {
        int length = CharClasses.letterRun(input, 0);
        if (length == 0) {
            return LexerOutcome.ignored();
        }
        var token = keywords.get(normalize(input.subSequence(0, length)
                                                .toString()));
        return token == null
               ? LexerOutcome.ignored()
               : LexerOutcome.consumed(token, input, length);
    }

    private static <T> void register(Map<String, T> normalized, String word, T token) {
        if (normalized.putIfAbsent(normalize(word), token) != null) {
            throw new IllegalArgumentException("Keyword " + word + " is already registered in another case");
        }
    }

    private static String normalize(String word) {
        return word.toUpperCase(Locale.ROOT);
    }
}
