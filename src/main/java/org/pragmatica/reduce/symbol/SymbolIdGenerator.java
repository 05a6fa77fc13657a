package org.pragmatica.reduce.symbol;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues {@link SymbolId}s unique to this generator.
 *
 * <p>Every generator takes its scope from a process-wide counter, so ids from two generators
 * are never equal even when their sequence numbers coincide. The scope counter is shared and
 * incremented atomically; a single generator instance is not thread-safe and is meant to be
 * owned by one grammar construction session.
 */
public final class SymbolIdGenerator {
    private static final AtomicLong SCOPES = new AtomicLong();

    private final long scope;
    private long sequence;

    private SymbolIdGenerator(long scope) {
        this.scope = scope;
        this.sequence = 0;
    }

    public static SymbolIdGenerator create() {
        return new SymbolIdGenerator(SCOPES.getAndIncrement());
    }

    /**
     * Issue the next id. Sequence numbers are never reused.
     */
    public SymbolId next() {
        return new SymbolId(scope, sequence++);
    }

    public long scope() {
        return scope;
    }

    /**
     * Number of ids issued so far.
     */
    public long issued() {
        return sequence;
    }

    public boolean owns(SymbolId id) {
        return id.scope() == scope && id.sequence() < sequence;
    }
}
