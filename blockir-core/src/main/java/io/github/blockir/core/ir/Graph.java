package io.github.blockir.core.ir;

import io.github.blockir.core.ext.CommonExts;
import io.github.blockir.core.ext.ExtHolder;

/**
 * A graph, owning a single root {@link Block}.
 */
public final class Graph extends ExtHolder {
    private final Block block = new Block();

    public Graph() {
        block.attachExt(CommonExts.OWNING_GRAPH, this);
    }

    /**
     * Get the root block of this graph.
     *
     * @return The root block.
     */
    public Block getBlock() {
        return block;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("graph ");
        block.appendTo(sb, "");
        return sb.toString();
    }
}
