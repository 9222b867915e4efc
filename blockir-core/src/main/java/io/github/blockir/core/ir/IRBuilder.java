package io.github.blockir.core.ir;

import io.github.blockir.core.ops.Op;

/**
 * An IR builder, which encapsulates the block that nodes are being appended to.
 */
public class IRBuilder {
    private Block block;

    /**
     * Construct a builder appending to the root block of a graph.
     *
     * @param graph The graph.
     */
    public IRBuilder(Graph graph) {
        this(graph.getBlock());
    }

    /**
     * Construct a builder appending to a specific block.
     *
     * @param block The block.
     */
    public IRBuilder(Block block) {
        this.block = block;
    }

    /**
     * Get the block this builder is appending to.
     *
     * @return The block.
     */
    public Block getBlock() {
        return block;
    }

    /**
     * Set the block this builder should append to.
     *
     * @param block The block.
     */
    public void setBlock(Block block) {
        this.block = block;
    }

    /**
     * Create a node for the operation, and append it to the current block.
     *
     * @param op The operation.
     * @return The new node.
     */
    public Node insert(Op op) {
        return block.addNode(op.node());
    }

    /**
     * Append a detached node to the current block.
     *
     * @param node The node.
     * @return The same node.
     */
    public Node insert(Node node) {
        return block.addNode(node);
    }
}
