package org.pragmatica.reduce.error;

import org.pragmatica.reduce.tree.SourceLocation;
import org.pragmatica.reduce.tree.SourceSpan;

/**
 * Errors that end a parse, with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Stable code used when rendering the error as a {@link Diagnostic}.
     */
    String code();

    /**
     * Source region the error points at.
     */
    default SourceSpan span() {
        return SourceSpan.at(location());
    }

    default Diagnostic toDiagnostic() {
        return Diagnostic.error(code(), message(), span());
    }

    /**
     * A recognizer claimed the input at this position but the input does not have the shape
     * it expects, e.g. a quoted literal without its closing quote.
     */
    record MalformedToken(
    SourceLocation location,
    String recognizer,
    String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }

        @Override
        public String code() {
            return "E0001";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(code(), reason, span())
                             .withLabel("rejected by " + recognizer);
        }
    }

    /**
     * A recognizer reported success but returned a remainder that is not a strictly shorter
     * suffix of its input.
     */
    record InvalidRemainder(
    SourceLocation location,
    String recognizer,
    int inputLength,
    int remainderLength) implements ParseError {
        @Override
        public String message() {
            return "Recognizer " + recognizer + " returned a remainder of length " + remainderLength
                   + " for input of length " + inputLength + " at " + location;
        }

        @Override
        public String code() {
            return "E0002";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(code(), "recognizer made no progress", span())
                             .withLabel(recognizer + " returned an invalid remainder")
                             .withHelp("a successful recognizer must consume at least one character");
        }
    }

    /**
     * Input was exhausted while more than one tree remained on the working stack.
     */
    record UnreducedInput(
    SourceLocation location,
    int unreduced) implements ParseError {
        @Override
        public String message() {
            return unreduced + " unreduced element(s) left below the root at " + location;
        }

        @Override
        public String code() {
            return "E0003";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(code(), "input did not reduce to a single tree", span())
                             .withLabel(unreduced + " element(s) left unreduced")
                             .withHelp("check that the grammar has a rule combining the remaining elements");
        }
    }
}
