package io.github.blockir.core.ext;

import io.github.blockir.core.ir.Block;
import io.github.blockir.core.ir.Graph;
import io.github.blockir.core.ir.Node;

/**
 * The {@link Ext}s that link the IR together.
 * <p>
 * All three are non-owning back-references. {@link Block} and {@link Node}
 * store them in fields, and keep them up to date as nodes are moved around.
 */
public class CommonExts {
    /**
     * Attached to the root {@link Block} of a {@link Graph}. The graph the block is the root of.
     */
    public static final Ext<Graph> OWNING_GRAPH = Ext.create(Graph.class, "OWNING_GRAPH");
    /**
     * Attached to a {@link Node}. The block the node directly sits in.
     */
    public static final Ext<Block> OWNING_BLOCK = Ext.create(Block.class, "OWNING_BLOCK");
    /**
     * Attached to a non-root {@link Block}. The node the block is a child block of.
     */
    public static final Ext<Node> OWNING_NODE = Ext.create(Node.class, "OWNING_NODE");
}
