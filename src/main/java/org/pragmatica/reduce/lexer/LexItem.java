package org.pragmatica.reduce.lexer;

import org.pragmatica.reduce.error.ParseError;
import org.pragmatica.reduce.tree.SourceSpan;

/**
 * Element of a {@link TokenStream}: a recognized token or the error that ended the stream.
 *
 * @param <T> token type
 */
public sealed interface LexItem<T> {

    boolean isToken();

    default boolean isError() {
        return !isToken();
    }

    record Token<T>(T value, SourceSpan span) implements LexItem<T> {
        @Override
        public boolean isToken() {
            return true;
        }
    }

    record Error<T>(ParseError error) implements LexItem<T> {
        @Override
        public boolean isToken() {
            return false;
        }
    }
}
