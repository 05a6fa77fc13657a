package org.pragmatica.reduce.tree;

import org.pragmatica.reduce.symbol.SymbolId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parse tree produced by the grammar engine.
 *
 * <p>A tree is either a {@link Leaf} wrapping one input token that was shifted but never reduced,
 * or a {@link Node} created by a reduction. Nodes own their children exclusively; trees are built
 * bottom-up, so cycles are impossible.
 *
 * @param <T> token type
 */
public sealed interface ParseTree<T> {

    boolean isLeaf();

    default boolean isNode() {
        return !isLeaf();
    }

    /**
     * Symbol of this tree, empty for leaves.
     */
    Optional<SymbolId> symbolId();

    /**
     * Number of tokens covered by this tree.
     */
    int width();

    /**
     * Tokens covered by this tree in input order.
     */
    List<T> tokens();

    static <T> Leaf<T> leaf(T token) {
        return new Leaf<>(token);
    }

    static <T> Node<T> node(SymbolId symbol, List<ParseTree<T>> children) {
        return new Node<>(symbol, children);
    }

    /**
     * Shifted input token.
     */
    record Leaf<T>(T token) implements ParseTree<T> {
        public Leaf {
            Objects.requireNonNull(token, "token");
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public Optional<SymbolId> symbolId() {
            return Optional.empty();
        }

        @Override
        public int width() {
            return 1;
        }

        @Override
        public List<T> tokens() {
            return List.of(token);
        }
    }

    /**
     * Result of a reduction. Children are kept in the order of the rule's right-hand side.
     */
    record Node<T>(SymbolId symbol, List<ParseTree<T>> children) implements ParseTree<T> {
        public Node {
            Objects.requireNonNull(symbol, "symbol");
            children = List.copyOf(children);
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        @Override
        public Optional<SymbolId> symbolId() {
            return Optional.of(symbol);
        }

        public ParseTree<T> child(int index) {
            return children.get(index);
        }

        public boolean is(SymbolId id) {
            return symbol.equals(id);
        }

        @Override
        public int width() {
            int width = 0;
            var pending = new ArrayDeque<ParseTree<T>>(children);
            while (!pending.isEmpty()) {
                if (pending.pop() instanceof Node<T> node) {
                    node.children()
                        .forEach(pending::push);
                } else {
                    width++;
                }
            }
            return width;
        }

        /**
         * Walks the tree with an explicit stack; left-recursive list rules nest one level per token.
         */
        @Override
        public List<T> tokens() {
            var tokens = new ArrayList<T>();
            var pending = new ArrayDeque<ParseTree<T>>();
            pushReversed(pending, children);
            while (!pending.isEmpty()) {
                var tree = pending.pop();
                if (tree instanceof Leaf<T> leaf) {
                    tokens.add(leaf.token());
                } else {
                    pushReversed(pending, ((Node<T>) tree).children());
                }
            }
            return List.copyOf(tokens);
        }

        private static <T> void pushReversed(Deque<ParseTree<T>> pending, List<ParseTree<T>> trees) {
            for (int i = trees.size() - 1; i >= 0; i--) {
                pending.push(trees.get(i));
            }
        }
    }
}
