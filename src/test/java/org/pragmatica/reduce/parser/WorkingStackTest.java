package org.pragmatica.reduce.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.reduce.tree.ParseTree;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkingStackTest {

    @Test
    void pop_returnsDeepestFirst() {
        var stack = stackOf("a", "b", "c");

        var popped = stack.pop(2);

        assertEquals(List.of(ParseTree.leaf("b"), ParseTree.leaf("c")), popped);
        assertEquals(List.of(ParseTree.leaf("a")), stack.snapshot());
    }

    @Test
    void suffix_coversElementsToTop() {
        var stack = stackOf("a", "b", "c");

        assertEquals(3, stack.suffix(0).size());
        assertEquals(List.of(ParseTree.leaf("c")), stack.suffix(2));
        assertThrows(UnsupportedOperationException.class, () -> stack.suffix(0).clear());
    }

    @Test
    void pop_moreThanSize_throws() {
        var stack = stackOf("a");

        assertThrows(IllegalArgumentException.class, () -> stack.pop(2));
        assertEquals(1, stack.size());
    }

    @Test
    void snapshot_isDetachedFromStack() {
        var stack = stackOf("a");
        var snapshot = stack.snapshot();

        stack.push(ParseTree.leaf("b"));

        assertEquals(1, snapshot.size());
        assertFalse(stack.isEmpty());
    }

    private static WorkingStack<String> stackOf(String... tokens) {
        var stack = WorkingStack.<String>create();
        for (var token : tokens) {
            stack.push(ParseTree.leaf(token));
        }
        return stack;
    }
}
