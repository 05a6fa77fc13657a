package org.pragmatica.reduce.grammar;

import org.pragmatica.reduce.symbol.SymbolId;
import org.pragmatica.reduce.symbol.SymbolIdGenerator;
import org.pragmatica.reduce.tree.ParseTree;
import org.pragmatica.reduce.tree.TreePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A complete set of substitution rules.
 *
 * <p>The first rule added becomes the default rule. When several rules match the same stack
 * suffix the engine picks the first in {@link #rules()} order: the default rule, then the others
 * in insertion order.
 *
 * <p>Example usage:
 * <pre>{@code
 * var builder = Grammar.<Token>builder();
 * var relOp = builder.symbol("RelOp");
 * var grammar = builder.add(Rule.<Token>builder(relOp).token(LESS).token(EQUALS).build())
 *                      .add(Rule.<Token>builder(relOp).token(LESS).build())
 *                      .build()
 *                      .orElseThrow();
 * }</pre>
 *
 * <p>A grammar is immutable and may be shared between threads.
 */
public final class Grammar<T> {
    private final SymbolIdGenerator generator;
    private final Rule<T> defaultRule;
    private final List<Rule<T>> additionalRules;
    private final List<Rule<T>> rules;
    private final Map<SymbolId, String> symbolNames;

    private Grammar(SymbolIdGenerator generator,
                    Rule<T> defaultRule,
                    List<Rule<T>> additionalRules,
                    Map<SymbolId, String> symbolNames) {
        this.generator = generator;
        this.defaultRule = defaultRule;
        this.additionalRules = List.copyOf(additionalRules);
        this.rules = Stream.concat(Stream.of(defaultRule), this.additionalRules.stream())
                           .toList();
        this.symbolNames = Map.copyOf(symbolNames);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>(SymbolIdGenerator.create());
    }

    public Rule<T> defaultRule() {
        return defaultRule;
    }

    public List<Rule<T>> additionalRules() {
        return additionalRules;
    }

    /**
     * All rules in matching order.
     */
    public List<Rule<T>> rules() {
        return rules;
    }

    /**
     * Scope of the generator that issued this grammar's symbols.
     */
    public long scope() {
        return generator.scope();
    }

    public Optional<String> symbolName(SymbolId id) {
        return Optional.ofNullable(symbolNames.get(id));
    }

    /**
     * Display name of a symbol, falling back to the id itself.
     */
    public String describe(SymbolId id) {
        return symbolName(id).orElseGet(id::toString);
    }

    /**
     * Render a tree produced with this grammar, using symbol names where known.
     */
    public String print(ParseTree<T> tree) {
        return TreePrinter.<T>create(this::describe)
                          .print(tree);
    }

    @Override
    public String toString() {
        return rules.stream()
                    .map(rule -> describe(rule.input()) + " -> " + rule.schema()
                                                                     .stream()
                                                                     .map(this::describeSchema)
                                                                     .collect(Collectors.joining(" ")))
                    .collect(Collectors.joining("\n"));
    }

    private String describeSchema(SymbolSchema<T> schema) {
        return schema instanceof SymbolSchema.Nonterminal<T> nonterminal
               ? describe(nonterminal.symbol())
               : schema.toString();
    }

    /**
     * Collects symbols and rules for one grammar. Not thread-safe.
     */
    public static final class Builder<T> {
        private static final Logger log = LoggerFactory.getLogger(Grammar.class);

        private final SymbolIdGenerator generator;
        private final Map<SymbolId, String> symbolNames = new HashMap<>();
        private final List<Rule<T>> additionalRules = new ArrayList<>();
        private Rule<T> defaultRule;

        private Builder(SymbolIdGenerator generator) {
            this.generator = generator;
        }

        /**
         * Issue a fresh nonterminating symbol.
         */
        public SymbolId symbol() {
            return generator.next();
        }

        /**
         * Issue a fresh nonterminating symbol with a display name.
         */
        public SymbolId symbol(String name) {
            var id = generator.next();
            symbolNames.put(id, Objects.requireNonNull(name, "name"));
            return id;
        }

        /**
         * Add a rule. The first rule added becomes the default rule.
         */
        public Builder<T> add(Rule<T> rule) {
            Objects.requireNonNull(rule, "rule");
            if (defaultRule == null) {
                defaultRule = rule;
            } else {
                additionalRules.add(rule);
            }
            return this;
        }

        /**
         * Build the grammar, or nothing if no rule was added.
         */
        public Optional<Grammar<T>> build() {
            if (defaultRule == null) {
                log.debug("Grammar has no rules, nothing to build");
                return Optional.empty();
            }
            var grammar = new Grammar<>(generator, defaultRule, additionalRules, symbolNames);
            grammar.rules()
                   .forEach(rule -> checkRule(grammar, rule));
            log.debug("Built grammar with {} rule(s) over {} symbol(s)", grammar.rules().size(), generator.issued());
            return Optional.of(grammar);
        }

        private void checkRule(Grammar<T> grammar, Rule<T> rule) {
            if (rule.schema().isEmpty()) {
                log.warn("Rule for {} has an empty right-hand side and will never match", grammar.describe(rule.input()));
            }
            rule.schema()
                .stream()
                .filter(schema -> schema instanceof SymbolSchema.Nonterminal<T> nonterminal
                                  && !generator.owns(nonterminal.symbol()))
                .forEach(schema -> log.warn("Rule for {} refers to {} which was not issued by this grammar",
                                            grammar.describe(rule.input()),
                                            schema));
            if (!generator.owns(rule.input())) {
                log.warn("Rule input {} was not issued by this grammar", rule.input());
            }
        }
    }
}
