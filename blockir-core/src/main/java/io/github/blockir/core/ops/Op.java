package io.github.blockir.core.ops;

import io.github.blockir.core.ir.Node;

/**
 * An operation: an {@link OpKey} together with any immediate arguments.
 */
public class Op {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    /**
     * Create a new, detached node performing this operation.
     *
     * @return The node.
     */
    public Node node() {
        return new Node(this);
    }

    @Override
    public String toString() {
        return key.toString();
    }
}
