package io.github.blockir.core.ir;

import io.github.blockir.core.ext.CommonExts;
import io.github.blockir.core.ext.Ext;
import io.github.blockir.core.ext.ExtHolder;
import io.github.blockir.core.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered sequence of {@link Node nodes}.
 * <p>
 * A block is either the root block of a {@link Graph}, or one of the child blocks
 * of a {@link Node}. Blocks are only ever created by their owner.
 */
public final class Block extends ExtHolder {
    private final TrackedList<Node> nodes = new TrackedList<Node>(new ArrayList<>()) {
        @Override
        protected void onAdded(Node elt) {
            checkCanHold(elt);
            elt.attachExt(CommonExts.OWNING_BLOCK, Block.this);
        }

        @Override
        protected void onRemoved(Node elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    Block() {
    }

    private void checkCanHold(Node node) {
        Block current = node.getOwningBlock();
        if (current != null) {
            throw new IllegalArgumentException(node + " is already in a block");
        }
        for (Block b = this; b != null; ) {
            Node owner = b.getOwningNode();
            if (owner == node) {
                throw new IllegalArgumentException(node + " cannot be placed inside its own child block");
            }
            b = owner == null ? null : owner.getOwningBlock();
        }
    }

    /**
     * Get the nodes in this block. Adding a node to, or removing it from, the list
     * updates its {@link Node#getOwningBlock() owning block}.
     *
     * @return The list of nodes.
     */
    public List<Node> getNodes() {
        return nodes;
    }

    /**
     * Add a node to the end of this block.
     *
     * @param node The node, which must not be in a block already.
     * @return The node.
     */
    public Node addNode(Node node) {
        nodes.add(node);
        return node;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Get the node this block is a child block of.
     *
     * @return The owning node, or null if this is the root block of a graph.
     */
    @Nullable
    public Node getOwningNode() {
        return ownerNode;
    }

    /**
     * Get the graph this block is the root block of.
     *
     * @return The graph, or null if this is not a root block.
     */
    @Nullable
    public Graph getGraph() {
        return ownerGraph;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, "");
        return sb.toString();
    }

    void appendTo(StringBuilder sb, String indent) {
        if (nodes.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append("{\n");
        String inner = indent + "  ";
        for (Node node : nodes) {
            sb.append(inner).append(node);
            for (Block child : node.getBlocks()) {
                sb.append(' ');
                child.appendTo(sb, inner);
            }
            sb.append('\n');
        }
        sb.append(indent).append('}');
    }

    // exts
    private Node ownerNode = null;
    private Graph ownerGraph = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_NODE) {
            return (T) ownerNode;
        } else if (ext == CommonExts.OWNING_GRAPH) {
            return (T) ownerGraph;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_NODE) {
            ownerNode = (Node) value;
            return;
        } else if (ext == CommonExts.OWNING_GRAPH) {
            ownerGraph = (Graph) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_NODE) {
            ownerNode = null;
            return;
        } else if (ext == CommonExts.OWNING_GRAPH) {
            ownerGraph = null;
            return;
        }
        super.removeExt(ext);
    }
}
