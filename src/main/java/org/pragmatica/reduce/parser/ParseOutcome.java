package org.pragmatica.reduce.parser;

import org.pragmatica.reduce.tree.ParseTree;

import java.util.List;
import java.util.Optional;

/**
 * Final working stack of one parse, bottom first.
 *
 * <p>A fully reduced input leaves exactly one element. Anything below the top is input the
 * grammar could not fold into the final tree.
 */
public record ParseOutcome<T>(List<ParseTree<T>> stack) {
    public ParseOutcome {
        stack = List.copyOf(stack);
    }

    /**
     * Top of the stack, empty when there was no input.
     */
    public Optional<ParseTree<T>> root() {
        return stack.isEmpty()
               ? Optional.empty()
               : Optional.of(stack.get(stack.size() - 1));
    }

    /**
     * Elements below the top, bottom first.
     */
    public List<ParseTree<T>> unreduced() {
        return stack.isEmpty()
               ? List.of()
               : stack.subList(0, stack.size() - 1);
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    /**
     * Whether the input reduced to exactly one tree.
     */
    public boolean isComplete() {
        return stack.size() == 1;
    }
}
