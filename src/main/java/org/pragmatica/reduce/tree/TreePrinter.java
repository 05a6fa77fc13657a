package org.pragmatica.reduce.tree;

import org.pragmatica.reduce.symbol.SymbolId;

import java.util.ArrayDeque;
import java.util.function.Function;

/**
 * Renders a {@link ParseTree} as indented text, one tree element per line.
 *
 * <pre>
 * RelOp
 *   '<'
 *   '='
 * </pre>
 */
public final class TreePrinter<T> {
    private static final String INDENT = "  ";

    private final Function<SymbolId, String> symbolNames;
    private final Function<? super T, String> tokenText;

    private TreePrinter(Function<SymbolId, String> symbolNames, Function<? super T, String> tokenText) {
        this.symbolNames = symbolNames;
        this.tokenText = tokenText;
    }

    public static <T> TreePrinter<T> create(Function<SymbolId, String> symbolNames) {
        return new TreePrinter<>(symbolNames, token -> "'" + token + "'");
    }

    public static <T> TreePrinter<T> create(Function<SymbolId, String> symbolNames,
                                            Function<? super T, String> tokenText) {
        return new TreePrinter<>(symbolNames, tokenText);
    }

    public String print(ParseTree<T> tree) {
        var sb = new StringBuilder();
        var pending = new ArrayDeque<Frame<T>>();
        pending.push(new Frame<>(tree, 0));
        while (!pending.isEmpty()) {
            var frame = pending.pop();
            sb.append(INDENT.repeat(frame.depth()));
            if (frame.tree() instanceof ParseTree.Node<T> node) {
                sb.append(symbolNames.apply(node.symbol()))
                  .append("\n");
                var children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(new Frame<>(children.get(i), frame.depth() + 1));
                }
            } else {
                sb.append(tokenText.apply(((ParseTree.Leaf<T>) frame.tree()).token()))
                  .append("\n");
            }
        }
        return sb.toString();
    }

    private record Frame<T>(ParseTree<T> tree, int depth) {}
}
