package org.pragmatica.reduce.parser;

import org.pragmatica.reduce.tree.ParseTree;

import java.util.Iterator;
import java.util.Optional;

/**
 * Parser interface - reduces a token sequence according to a grammar.
 */
public interface Parser<T> {

    /**
     * Parse tokens and return the tree on top of the working stack, or nothing for empty input.
     * Elements left below the top are dropped; use {@link #reduce(Iterator)} to inspect them.
     */
    Optional<ParseTree<T>> parse(Iterator<? extends T> tokens);

    default Optional<ParseTree<T>> parse(Iterable<? extends T> tokens) {
        return parse(tokens.iterator());
    }

    /**
     * Parse tokens and return the complete final working stack.
     */
    ParseOutcome<T> reduce(Iterator<? extends T> tokens);

    default ParseOutcome<T> reduce(Iterable<? extends T> tokens) {
        return reduce(tokens.iterator());
    }
}
