package org.pragmatica.reduce.grammar;

import org.pragmatica.reduce.symbol.SymbolId;
import org.pragmatica.reduce.tree.ParseTree;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One entry on the right-hand side of a {@link Rule}.
 *
 * @param <T> token type
 */
public sealed interface SymbolSchema<T> {

    /**
     * Whether the given stack element can stand in this position.
     */
    boolean matches(ParseTree<T> element);

    /**
     * Terminating symbol: matches a single shifted token accepted by the predicate.
     */
    record Terminal<T>(String description, Predicate<? super T> predicate) implements SymbolSchema<T> {
        public Terminal {
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public boolean matches(ParseTree<T> element) {
            return element instanceof ParseTree.Leaf<T> leaf && predicate.test(leaf.token());
        }

        @Override
        public String toString() {
            return description;
        }
    }

    /**
     * Nonterminating symbol: matches a reduced node carrying the same symbol id.
     */
    record Nonterminal<T>(SymbolId symbol) implements SymbolSchema<T> {
        public Nonterminal {
            Objects.requireNonNull(symbol, "symbol");
        }

        @Override
        public boolean matches(ParseTree<T> element) {
            return element instanceof ParseTree.Node<T> node && node.symbol()
                                                                    .equals(symbol);
        }

        @Override
        public String toString() {
            return symbol.toString();
        }
    }
}
