package org.pragmatica.reduce.lexer;

import org.pragmatica.reduce.error.ParseError;
import org.pragmatica.reduce.tree.SourceLocation;
import org.pragmatica.reduce.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-pass sequence of tokens produced by a {@link Lexer}.
 *
 * <p>Each pull runs the recognizers against the remaining input:
 * <ol>
 *     <li>empty remaining input ends the stream;</li>
 *     <li>the first recognizer returning success or failure decides;</li>
 *     <li>a failure is yielded as an {@link LexItem.Error} and ends the stream for good;</li>
 *     <li>if every recognizer ignores the input, one character is discarded and the
 *     recognizers are tried again from the next position.</li>
 * </ol>
 */
public final class TokenStream<T> implements Iterator<LexItem<T>> {
    private static final Logger log = LoggerFactory.getLogger(TokenStream.class);

    private final List<Recognizer<T>> recognizers;

    private InputSlice remaining;
    private SourceLocation location;
    private LexItem<T> pending;
    private boolean finished;

    TokenStream(List<Recognizer<T>> recognizers, String input) {
        this.recognizers = recognizers;
        this.remaining = InputSlice.of(input);
        this.location = SourceLocation.START;
        this.finished = false;
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !finished) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public LexItem<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Token stream is exhausted");
        }
        var item = pending;
        pending = null;
        return item;
    }

    /**
     * Location of the first character not yet consumed.
     */
    public SourceLocation location() {
        return location;
    }

    /**
     * Remaining items as a sequential stream. Consumes this iterator.
     */
    public Stream<LexItem<T>> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                                    false);
    }

    /**
     * Drain the stream and return the token values, or the error that stopped it.
     */
    public Tokens<T> drain() {
        var values = new ArrayList<T>();
        while (hasNext()) {
            var item = next();
            if (item instanceof LexItem.Error<T> error) {
                return new Tokens<>(values, Optional.of(error.error()));
            }
            values.add(((LexItem.Token<T>) item).value());
        }
        return new Tokens<>(values, Optional.empty());
    }

    /**
     * Token values read before the stream ended, plus the error that ended it, if any.
     */
    public record Tokens<T>(List<T> values, Optional<ParseError> error) {
        public Tokens {
            values = List.copyOf(values);
        }

        public boolean isComplete() {
            return error.isEmpty();
        }
    }

    private LexItem<T> advance() {
        while (!remaining.isEmpty()) {
            var decided = tryRecognizers();
            if (decided != null) {
                return decided;
            }
            // nobody claimed this character
            location = location.advance(remaining.subSequence(0, 1));
            remaining = remaining.skip(1);
        }
        finished = true;
        return null;
    }

    private LexItem<T> tryRecognizers() {
        for (var recognizer : recognizers) {
            var outcome = recognizer.recognize(remaining);
            if (outcome instanceof LexerOutcome.Success<T> success) {
                return accept(recognizer, success);
            }
            if (outcome instanceof LexerOutcome.Failed<T> failed) {
                log.debug("{} rejected input at {}: {}", recognizer.name(), location, failed.reason());
                return fail(new ParseError.MalformedToken(location, recognizer.name(), failed.reason()));
            }
        }
        return null;
    }

    private LexItem<T> accept(Recognizer<T> recognizer, LexerOutcome.Success<T> success) {
        if (success.token() == null || success.remainder() == null) {
            var missing = success.token() == null ? "token" : "remainder";
            log.warn("{} reported success without a {} at {}", recognizer.name(), missing, location);
            return fail(new ParseError.MalformedToken(location, recognizer.name(), "Recognizer returned no " + missing));
        }
        var remainder = success.remainder();
        int consumed = remaining.length() - remainder.length();
        if (consumed <= 0 || !isSuffix(remainder)) {
            log.warn("{} returned an invalid remainder at {}", recognizer.name(), location);
            return fail(new ParseError.InvalidRemainder(location, recognizer.name(), remaining.length(), remainder.length()));
        }
        var start = location;
        location = location.advance(remaining.subSequence(0, consumed));
        remaining = remaining.skip(consumed);
        log.trace("{} produced {} at {}", recognizer.name(), success.token(), start);
        return new LexItem.Token<>(success.token(), SourceSpan.of(start, location));
    }

    private boolean isSuffix(CharSequence remainder) {
        if (remainder instanceof InputSlice slice && slice.source() == remaining.source()) {
            return slice.offset() + slice.length() == remaining.offset() + remaining.length();
        }
        int shift = remaining.length() - remainder.length();
        for (int i = 0; i < remainder.length(); i++) {
            if (remaining.charAt(shift + i) != remainder.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private LexItem<T> fail(ParseError error) {
        finished = true;
        return new LexItem.Error<>(error);
    }
}
