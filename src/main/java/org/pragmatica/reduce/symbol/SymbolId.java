package org.pragmatica.reduce.symbol;

/**
 * Identifier of a grammar symbol.
 *
 * <p>Two ids are equal only when both the generator scope and the sequence number are equal,
 * so ids issued by different {@link SymbolIdGenerator}s never collide.
 *
 * @param scope    scope of the generator that issued this id
 * @param sequence position of this id in its generator's issue order, starting at 0
 */
public record SymbolId(long scope, long sequence) {
    @Override
    public String toString() {
        return "#" + scope + "." + sequence;
    }
}
