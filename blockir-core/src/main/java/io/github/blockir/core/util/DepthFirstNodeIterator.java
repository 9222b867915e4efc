package io.github.blockir.core.util;

import io.github.blockir.core.ir.Block;
import io.github.blockir.core.ir.Graph;
import io.github.blockir.core.ir.Node;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A cursor over every {@link Node} in a {@link Graph}, in depth-first pre-order.
 * <p>
 * Each node is yielded before the nodes in its child blocks, which are yielded
 * block by block, in order, before the node's next sibling. Both blocks of a
 * conditional are visited, then-block first.
 * <p>
 * The cursor keeps no stack. When a block runs out it climbs back up through the
 * {@link Node#getOwningBlock() owning block} and {@link Block#getOwningNode() owning node}
 * back-references, relocating each ancestor in its block with a linear scan. Nesting depth
 * is therefore not limited by the call stack.
 * <p>
 * The graph must not be modified while a cursor over it is in use.
 */
public final class DepthFirstNodeIterator {
    private static final Logger LOGGER = LoggerFactory.getLogger(DepthFirstNodeIterator.class);

    private final Graph graph;
    // null once exhausted
    @Nullable
    private Block block;
    private int index;

    /**
     * Construct a cursor positioned at the first node of the graph's root block.
     *
     * @param graph The graph to traverse.
     */
    public DepthFirstNodeIterator(Graph graph) {
        this.graph = graph;
        Block root = graph.getBlock();
        block = root.isEmpty() ? null : root;
    }

    /**
     * Get the next node, and move past it.
     *
     * @return The next node, or null if every node has been visited.
     * @throws IllegalStateException If the graph does not hang together.
     */
    @Nullable
    public Node next() {
        if (block == null) return null;
        Node node = block.getNodes().get(index);
        moveNext(node);
        return node;
    }

    private void moveNext(Node node) {
        for (Block child : node.getBlocks()) {
            if (!child.isEmpty()) {
                block = child;
                index = 0;
                return;
            }
        }
        moveAfter(node);
    }

    private void moveAfter(Node finished) {
        while (true) {
            Block parent = finished.getOwningBlock();
            if (parent == null) {
                throw malformed(finished, "is not in any block");
            }
            int next = indexIn(parent, finished) + 1;
            if (next < parent.getNodes().size()) {
                block = parent;
                index = next;
                return;
            }

            Node owner = parent.getOwningNode();
            if (owner == null) {
                if (parent != graph.getBlock()) {
                    throw malformed(finished, "is not reachable from the root block of the graph");
                }
                LOGGER.debug("Depth-first traversal exhausted after {}", finished);
                block = null;
                return;
            }
            if (!owner.getKind().hasBlocks()) {
                throw malformed(owner, "owns a block but is " + owner.getKind());
            }
            List<Block> siblings = owner.getBlocks();
            int blockIndex = indexIn(siblings, parent);
            if (blockIndex < 0) {
                throw malformed(owner, "does not list the block of " + finished + " as a child");
            }
            LOGGER.trace("Climbing out of block {} of {}", blockIndex, owner);
            for (int i = blockIndex + 1; i < siblings.size(); i++) {
                Block sibling = siblings.get(i);
                if (!sibling.isEmpty()) {
                    block = sibling;
                    index = 0;
                    return;
                }
            }
            finished = owner;
        }
    }

    private static int indexIn(Block parent, Node node) {
        int i = indexIn(parent.getNodes(), node);
        if (i < 0) {
            throw malformed(node, "is missing from its owning block");
        }
        return i;
    }

    private static <T> int indexIn(List<T> ls, T t) {
        for (int i = 0; i < ls.size(); i++) {
            if (ls.get(i) == t) return i;
        }
        return -1;
    }

    private static IllegalStateException malformed(Node node, String problem) {
        IllegalStateException e = new IllegalStateException("Malformed graph: " + node + " " + problem);
        if (node.created != null) {
            e.addSuppressed(node.created);
        }
        return e;
    }

    /**
     * Get the depth-first order of a graph, as an {@link Iterable}.
     * Every call to {@link Iterable#iterator()} starts a fresh cursor, which only
     * advances when {@link Iterator#hasNext()} or {@link Iterator#next()} is called.
     *
     * @param graph The graph.
     * @return The order.
     */
    public static Order order(Graph graph) {
        return () -> new Iterator<Node>() {
            private final DepthFirstNodeIterator cursor = new DepthFirstNodeIterator(graph);
            private Node pending;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (pending == null && !done) {
                    pending = cursor.next();
                    done = pending == null;
                }
                return pending != null;
            }

            @Override
            public Node next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Node ret = pending;
                pending = null;
                return ret;
            }
        };
    }

    /**
     * The nodes of a graph, in depth-first order.
     */
    public interface Order extends Iterable<Node> {
        /**
         * Collect this order to a list.
         *
         * @return The nodes of the graph, in this order.
         */
        default List<Node> toList() {
            List<Node> ls = new ArrayList<>();
            for (Node node : this) {
                ls.add(node);
            }
            return ls;
        }
    }
}
