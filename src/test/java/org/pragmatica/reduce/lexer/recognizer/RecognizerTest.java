package org.pragmatica.reduce.lexer.recognizer;

import org.junit.jupiter.api.Test;
import org.pragmatica.reduce.lexer.LexerOutcome;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the reusable recognizers, applied directly without a lexer.
 */
class RecognizerTest {

    private enum Word { CLEAR, PRINT }

    // === Keywords ===

    @Test
    void keyword_exactWord_isRecognized() {
        var recognizer = KeywordRecognizer.of(Word.class, Word::name);

        var outcome = recognizer.recognize("CLEAR\n");

        assertSuccess(outcome, "CLEAR", "\n");
    }

    @Test
    void keyword_isCaseInsensitive() {
        var recognizer = KeywordRecognizer.of(Map.of("print", 1));

        assertSuccess(recognizer.recognize("Print A"), 1, " A");
    }

    @Test
    void keyword_longerWord_isIgnored() {
        var recognizer = KeywordRecognizer.of(Word.class, Word::name);

        assertTrue(recognizer.recognize("CLEARS").isIgnored());
        assertTrue(recognizer.recognize("10 CLEAR").isIgnored());
    }

    @Test
    void keyword_followedByDigit_stillMatches() {
        var recognizer = KeywordRecognizer.of(Word.class, Word::name);

        assertSuccess(recognizer.recognize("PRINT1"), "PRINT", "1");
    }

    @Test
    void keyword_spellingsDifferingOnlyInCase_areRejected() {
        var keywords = new LinkedHashMap<String, Integer>();
        keywords.put("Print", 1);
        keywords.put("PRINT", 2);

        var error = assertThrows(IllegalArgumentException.class, () -> KeywordRecognizer.of(keywords));
        assertThat(error.getMessage()).contains("already registered");
    }

    // === Words ===

    @Test
    void word_takesLettersAndDigits() {
        var recognizer = new WordRecognizer<String>(word -> word);

        assertSuccess(recognizer.recognize("ab12 c"), "ab12", " c");
    }

    @Test
    void word_respectsMaxLength() {
        var recognizer = new WordRecognizer<String>(1, word -> word);

        assertSuccess(recognizer.recognize("AB"), "A", "B");
    }

    @Test
    void word_mustStartWithLetter() {
        var recognizer = new WordRecognizer<String>(word -> word);

        assertTrue(recognizer.recognize("1ab").isIgnored());
    }

    @Test
    void word_nonPositiveMaxLength_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WordRecognizer<String>(0, word -> word));
    }

    // === Numbers ===

    @Test
    void number_parsesDigitRun() {
        var recognizer = new NumberRecognizer<Long>(value -> value);

        assertSuccess(recognizer.recognize("0042 PRINT"), 42L, " PRINT");
    }

    @Test
    void number_nonDigit_isIgnored() {
        var recognizer = new NumberRecognizer<Long>(value -> value);

        assertTrue(recognizer.recognize("-1").isIgnored());
    }

    @Test
    void number_overflow_isMalformed() {
        var recognizer = new NumberRecognizer<Long>(value -> value);

        var outcome = recognizer.recognize("99999999999999999999");

        assertTrue(outcome.isFailed());
        assertThat(((LexerOutcome.Failed<Long>) outcome).reason()).startsWith("Number out of range");
    }

    // === Quoted strings ===

    @Test
    void quoted_returnsTextBetweenQuotes() {
        var recognizer = new QuotedStringRecognizer<String>(text -> text);

        assertSuccess(recognizer.recognize("\"Hello, \", A"), "Hello, ", ", A");
    }

    @Test
    void quoted_emptyLiteral_isAllowed() {
        var recognizer = new QuotedStringRecognizer<String>(text -> text);

        assertSuccess(recognizer.recognize("\"\""), "", "");
    }

    @Test
    void quoted_missingClosingQuote_isMalformed() {
        var recognizer = new QuotedStringRecognizer<String>(text -> text);

        assertTrue(recognizer.recognize("\"abc").isFailed());
        assertTrue(recognizer.recognize("\"abc\n\"").isFailed());
    }

    @Test
    void quoted_customQuote() {
        var recognizer = new QuotedStringRecognizer<String>('\'', text -> text);

        assertTrue(recognizer.recognize("\"x\"").isIgnored());
        assertSuccess(recognizer.recognize("'x'"), "x", "");
    }

    // === Single characters ===

    @Test
    void character_mapsKnownCharacters() {
        var recognizer = CharacterRecognizer.of(Map.of('<', "LT", '\n', "NL"));

        assertSuccess(recognizer.recognize("<="), "LT", "=");
        assertSuccess(recognizer.recognize("\n20"), "NL", "20");
        assertTrue(recognizer.recognize("=").isIgnored());
    }

    private static <T> void assertSuccess(LexerOutcome<T> outcome, T token, String remainder) {
        assertInstanceOf(LexerOutcome.Success.class, outcome);
        var success = (LexerOutcome.Success<T>) outcome;
        assertEquals(token, success.token());
        assertEquals(remainder, success.remainder().toString());
    }
}
