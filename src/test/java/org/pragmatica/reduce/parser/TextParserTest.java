package org.pragmatica.reduce.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.reduce.error.Diagnostic;
import org.pragmatica.reduce.error.ParseError;
import org.pragmatica.reduce.grammar.Grammar;
import org.pragmatica.reduce.grammar.Rule;
import org.pragmatica.reduce.lexer.Lexer;
import org.pragmatica.reduce.lexer.recognizer.CharacterRecognizer;
import org.pragmatica.reduce.lexer.recognizer.QuotedStringRecognizer;
import org.pragmatica.reduce.lexer.recognizer.WordRecognizer;
import org.pragmatica.reduce.symbol.SymbolId;
import org.pragmatica.reduce.tree.ParseTree;
import org.pragmatica.reduce.tree.SourceLocation;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TextParser}: lexing and reduction combined, with leftover policies.
 */
class TextParserTest {

    private static final Lexer<String> LEXER = Lexer.<String>builder()
                                                    .add(new QuotedStringRecognizer<String>(text -> "\"" + text + "\""))
                                                    .add(new WordRecognizer<String>(word -> word))
                                                    .add(CharacterRecognizer.of(Map.of('+', "+", '=', "=")))
                                                    .build();

    private final Grammar.Builder<String> builder = Grammar.builder();
    private final SymbolId sum = builder.symbol("Sum");
    private final Grammar<String> grammar = builder.add(Rule.<String>builder(sum)
                                                            .terminal("word", TextParserTest::isWord)
                                                            .token("+")
                                                            .terminal("word", TextParserTest::isWord)
                                                            .build())
                                                   .build()
                                                   .orElseThrow();

    // === Successful parses ===

    @Test
    void parse_fullyReducedInput_succeedsWithoutDiagnostics() {
        var parser = parser(ParserConfig.DEFAULT);

        var result = parser.parse("a + b");

        assertTrue(result.isSuccess());
        var success = assertInstanceOf(ParseResult.Success.class, result);
        assertTrue(success.isComplete());
        assertTrue(result.diagnostics().isEmpty());
        assertEquals(ParseTree.node(sum, List.of(ParseTree.leaf("a"), ParseTree.leaf("+"), ParseTree.leaf("b"))),
                     result.root().orElseThrow());
    }

    @Test
    void parse_blankInput_isEmpty() {
        var result = parser(ParserConfig.DEFAULT).parse("   \n ");

        assertInstanceOf(ParseResult.Empty.class, result);
        assertTrue(result.isSuccess());
        assertTrue(result.root().isEmpty());
    }

    // === Leftover policies ===

    @Test
    void parse_permissive_returnsTopWithWarning() {
        var result = parser(ParserConfig.DEFAULT).parse("x a + b");

        var success = (ParseResult.Success<String>) assertInstanceOf(ParseResult.Success.class, result);
        assertFalse(success.isComplete());
        assertEquals(List.of(ParseTree.leaf("x")), success.unreduced());
        assertEquals(sum, ((ParseTree.Node<String>) success.tree()).symbol());

        assertThat(result.diagnostics()).hasSize(1);
        var warning = result.diagnostics().get(0);
        assertEquals(Diagnostic.Severity.WARNING, warning.severity());
        assertEquals("W0001", warning.code());
        assertEquals(SourceLocation.at(1, 8, 7), warning.span().start());
    }

    @Test
    void parse_permissive_formatsWarning() {
        var result = parser(ParserConfig.DEFAULT).parse("x a + b");

        var formatted = result.formatDiagnostics("x a + b", "sum.txt");

        assertThat(formatted).startsWith("warning[W0001]: input did not reduce to a single tree\n  --> sum.txt:1:8\n");
        assertThat(formatted).contains("1 | x a + b\n");
        assertThat(formatted).contains("^ 1 element(s) below the result were left unreduced");
    }

    @Test
    void parse_strict_failsOnUnreducedInput() {
        var parser = parser(ParserConfig.DEFAULT.withLeftoverPolicy(LeftoverPolicy.STRICT));

        var result = parser.parse("x a + b");

        assertTrue(result.isFailure());
        var failure = (ParseResult.Failure<String>) result;
        assertEquals(new ParseError.UnreducedInput(SourceLocation.at(1, 8, 7), 1), failure.error());
        assertEquals("E0003", result.diagnostics().get(0).code());
    }

    @Test
    void parse_strict_acceptsCompleteInput() {
        var parser = parser(ParserConfig.DEFAULT.withLeftoverPolicy(LeftoverPolicy.STRICT));

        assertTrue(parser.parse("a+b").isSuccess());
    }

    // === Lexical errors ===

    @Test
    void parse_lexicalError_failsWithLocation() {
        var result = parser(ParserConfig.DEFAULT).parse("a + \"b");

        var failure = (ParseResult.Failure<String>) assertInstanceOf(ParseResult.Failure.class, result);
        var error = assertInstanceOf(ParseError.MalformedToken.class, failure.error());
        assertEquals(SourceLocation.at(1, 5, 4), error.location());
        assertEquals("E0001", result.diagnostics().get(0).code());
    }

    @Test
    void parse_lexicalError_winsOverPolicy() {
        var result = parser(ParserConfig.DEFAULT).parse("a + b \"unterminated");

        assertTrue(result.isFailure());
        assertTrue(result.root().isEmpty());
    }

    // === Limits ===

    @Test
    void parse_inputOverLimit_isRejected() {
        var parser = parser(ParserConfig.DEFAULT.withMaxInputLength(3));

        assertThrows(IllegalArgumentException.class, () -> parser.parse("a + b"));
        assertTrue(parser.parse("a+b").isSuccess());
    }

    @Test
    void parse_largeInput_acceptedByDefault() {
        var result = parser(ParserConfig.DEFAULT).parse(" ".repeat(2_000_000) + "a + b");

        var success = assertInstanceOf(ParseResult.Success.class, result);
        assertTrue(success.isComplete());
        assertEquals(Integer.MAX_VALUE, ParserConfig.DEFAULT.maxInputLength());
    }

    @Test
    void config_negativeLimit_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> ParserConfig.DEFAULT.withMaxInputLength(-1));
    }

    private TextParser<String> parser(ParserConfig config) {
        return TextParser.create(LEXER, ShiftReduceEngine.create(grammar), config);
    }

    private static boolean isWord(String token) {
        return !token.isEmpty() && Character.isLetter(token.charAt(0));
    }
}
