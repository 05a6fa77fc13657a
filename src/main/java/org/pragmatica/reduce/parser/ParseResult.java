package org.pragmatica.reduce.parser;

import org.pragmatica.reduce.error.Diagnostic;
import org.pragmatica.reduce.error.ParseError;
import org.pragmatica.reduce.tree.ParseTree;

import java.util.List;
import java.util.Optional;

/**
 * Result of parsing a text - a tree, nothing at all, or the error that stopped the parse.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return this instanceof Failure;
    }

    default Optional<ParseTree<T>> root() {
        return Optional.empty();
    }

    /**
     * Diagnostics produced by this parse: the error of a failure, warnings of a success.
     */
    List<Diagnostic> diagnostics();

    /**
     * Format all diagnostics in Rust style.
     *
     * @param source   the parsed text
     * @param filename optional filename for display
     */
    default String formatDiagnostics(String source, String filename) {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics()) {
            sb.append(diagnostic.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * The text produced a tree.
     *
     * @param tree      the tree left on top of the working stack
     * @param unreduced elements left below it, bottom first; empty when the input fully reduced
     * @param warnings  warnings about the unreduced elements
     */
    record Success<T>(
        ParseTree<T> tree,
        List<ParseTree<T>> unreduced,
        List<Diagnostic> warnings
    ) implements ParseResult<T> {

        public Success {
            unreduced = List.copyOf(unreduced);
            warnings = List.copyOf(warnings);
        }

        public static <T> Success<T> of(ParseTree<T> tree) {
            return new Success<>(tree, List.of(), List.of());
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<ParseTree<T>> root() {
            return Optional.of(tree);
        }

        @Override
        public List<Diagnostic> diagnostics() {
            return warnings;
        }

        public boolean isComplete() {
            return unreduced.isEmpty();
        }
    }

    /**
     * The text contained no tokens.
     */
    record Empty<T>() implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public List<Diagnostic> diagnostics() {
            return List.of();
        }
    }

    /**
     * Lexing failed, or the leftover policy rejected the final stack.
     */
    record Failure<T>(ParseError error) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public List<Diagnostic> diagnostics() {
            return List.of(error.toDiagnostic());
        }
    }
}
