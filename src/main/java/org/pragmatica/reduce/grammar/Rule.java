package org.pragmatica.reduce.grammar;

import org.pragmatica.reduce.symbol.SymbolId;
import org.pragmatica.reduce.tree.ParseTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A substitution rule: {@code input -> schema[0] schema[1] ...}.
 *
 * <p>Rules are assembled with {@link #builder(SymbolId)} and immutable once built.
 *
 * @param input  the nonterminating symbol produced by a reduction with this rule
 * @param schema the right-hand side, in matching order
 */
public record Rule<T>(SymbolId input, List<SymbolSchema<T>> schema) {
    public Rule {
        Objects.requireNonNull(input, "input");
        schema = List.copyOf(schema);
    }

    public static <T> Builder<T> builder(SymbolId input) {
        return new Builder<>(input);
    }

    public int length() {
        return schema.size();
    }

    /**
     * Whether {@code candidate} matches the right-hand side element by element.
     */
    public boolean matches(List<ParseTree<T>> candidate) {
        if (candidate.size() != schema.size()) {
            return false;
        }
        for (int i = 0; i < schema.size(); i++) {
            if (!schema.get(i).matches(candidate.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return input + " -> " + schema.stream()
                                      .map(SymbolSchema::toString)
                                      .collect(Collectors.joining(" "));
    }

    public static final class Builder<T> {
        private final SymbolId input;
        private final List<SymbolSchema<T>> schema = new ArrayList<>();

        private Builder(SymbolId input) {
            this.input = Objects.requireNonNull(input, "input");
        }

        public Builder<T> terminal(Predicate<? super T> predicate) {
            return terminal("<terminal>", predicate);
        }

        public Builder<T> terminal(String description, Predicate<? super T> predicate) {
            schema.add(new SymbolSchema.Terminal<>(description, predicate));
            return this;
        }

        /**
         * Terminal matching tokens equal to {@code expected}.
         */
        public Builder<T> token(T expected) {
            Objects.requireNonNull(expected, "expected");
            return terminal("'" + expected + "'", expected::equals);
        }

        public Builder<T> nonterminal(SymbolId symbol) {
            schema.add(new SymbolSchema.Nonterminal<>(symbol));
            return this;
        }

        public Rule<T> build() {
            return new Rule<>(input, schema);
        }
    }
}
