package org.begend.compiler.frontend.parser.ast;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out strictly increasing node identifiers, starting at 1.
 * <p>
 * A fresh generator per parse gives reproducible numbering. The {@link #shared()} instance is
 * process-wide, so identifiers are never reused across parses in the same process. Increments are
 * atomic, which lets concurrent parses share one generator.
 */
public final class NodeIdGenerator {

    private static final NodeIdGenerator SHARED = new NodeIdGenerator();

    private final AtomicInteger nextId = new AtomicInteger(1);

    /**
     * Returns the process-wide generator.
     * @return The shared generator.
     */
    public static NodeIdGenerator shared() {
        return SHARED;
    }

    /**
     * Returns a new identifier. Every call returns a value greater than all previous ones.
     * @return The next identifier.
     */
    public int next() {
        return nextId.getAndIncrement();
    }

    /**
     * Returns the identifier the next call to {@link #next()} will hand out, without consuming it.
     * @return The upcoming identifier.
     */
    public int peekNext() {
        return nextId.get();
    }
}
