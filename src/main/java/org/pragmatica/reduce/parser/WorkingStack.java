package org.pragmatica.reduce.parser;

import org.pragmatica.reduce.tree.ParseTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable stack of partially parsed trees for a single parse call.
 */
public final class WorkingStack<T> {
    private final List<ParseTree<T>> elements = new ArrayList<>();

    public static <T> WorkingStack<T> create() {
        return new WorkingStack<>();
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public void push(ParseTree<T> element) {
        elements.add(element);
    }

    /**
     * View of the elements from {@code from} to the top. Valid until the stack changes.
     */
    public List<ParseTree<T>> suffix(int from) {
        return Collections.unmodifiableList(elements.subList(from, elements.size()));
    }

    /**
     * Pop the top {@code count} elements and return them in stack order (deepest first).
     */
    public List<ParseTree<T>> pop(int count) {
        if (count < 0 || count > elements.size()) {
            throw new IllegalArgumentException("Cannot pop " + count + " of " + elements.size() + " elements");
        }
        var popped = new ArrayList<ParseTree<T>>(count);
        for (int i = 0; i < count; i++) {
            popped.add(elements.remove(elements.size() - 1));
        }
        Collections.reverse(popped);
        return popped;
    }

    public List<ParseTree<T>> snapshot() {
        return List.copyOf(elements);
    }
}
