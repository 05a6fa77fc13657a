package org.pragmatica.reduce.parser;

import org.pragmatica.reduce.grammar.Grammar;
import org.pragmatica.reduce.grammar.Rule;
import org.pragmatica.reduce.tree.ParseTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * Shift-reduce engine - interprets a {@link Grammar} over a token sequence.
 *
 * <p>Each token is shifted onto the working stack as a leaf. The engine then looks for one
 * reduction, trying the longest stack suffix first (the whole stack) and shrinking toward the
 * top element; for each suffix the rules are tried in grammar order and the first match wins.
 * The matched elements are replaced by a node carrying the rule's input symbol, with children in
 * right-hand-side order. At most one reduction happens per shifted token and there is no
 * backtracking.
 *
 * <p>The engine holds no per-parse state and may be shared between threads.
 */
public final class ShiftReduceEngine<T> implements Parser<T> {
    private static final Logger log = LoggerFactory.getLogger(ShiftReduceEngine.class);

    private final Grammar<T> grammar;

    private ShiftReduceEngine(Grammar<T> grammar) {
        this.grammar = grammar;
    }

    public static <T> ShiftReduceEngine<T> create(Grammar<T> grammar) {
        return new ShiftReduceEngine<>(Objects.requireNonNull(grammar, "grammar"));
    }

    public Grammar<T> grammar() {
        return grammar;
    }

    @Override
    public Optional<ParseTree<T>> parse(Iterator<? extends T> tokens) {
        return reduce(tokens).root();
    }

    @Override
    public ParseOutcome<T> reduce(Iterator<? extends T> tokens) {
        var stack = WorkingStack.<T>create();
        int shifted = 0;
        int reductions = 0;
        while (tokens.hasNext()) {
            T token = tokens.next();
            stack.push(ParseTree.leaf(token));
            shifted++;
            log.trace("shift {}", token);
            if (reduceOnce(stack)) {
                reductions++;
            }
        }
        log.debug("Parsed {} token(s) with {} reduction(s), {} element(s) left", shifted, reductions, stack.size());
        return new ParseOutcome<>(stack.snapshot());
    }

    private boolean reduceOnce(WorkingStack<T> stack) {
        for (int drop = 0; drop < stack.size(); drop++) {
            var candidate = stack.suffix(drop);
            for (var rule : grammar.rules()) {
                if (rule.matches(candidate)) {
                    apply(stack, rule);
                    return true;
                }
            }
        }
        return false;
    }

    private void apply(WorkingStack<T> stack, Rule<T> rule) {
        var children = stack.pop(rule.length());
        var node = ParseTree.node(rule.input(), children);
        log.trace("reduce {} element(s) to {}", children.size(), grammar.describe(rule.input()));
        stack.push(node);
    }
}
