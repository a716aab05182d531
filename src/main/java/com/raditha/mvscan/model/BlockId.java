package com.raditha.mvscan.model;

import java.util.Comparator;

/**
 * Identity of one basic block of the state dependency graph.
 * <p>
 * Block ids are totally ordered: by function identifier (lexicographic), then by
 * node id. The order decides whether a write "precedes" a read.
 *
 * @param function Contract-qualified function signature
 * @param node     Node id within the function
 */
public record BlockId(String function, int node) implements Comparable<BlockId> {

    private static final Comparator<BlockId> ORDER = Comparator
            .comparing(BlockId::function)
            .thenComparingInt(BlockId::node);

    public BlockId {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
    }

    @Override
    public int compareTo(BlockId other) {
        return ORDER.compare(this, other);
    }

    public boolean precedes(BlockId other) {
        return compareTo(other) < 0;
    }

    @Override
    public String toString() {
        return function + "#" + node;
    }
}
