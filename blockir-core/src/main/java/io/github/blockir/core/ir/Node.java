package io.github.blockir.core.ir;

import io.github.blockir.core.ext.CommonExts;
import io.github.blockir.core.ext.Ext;
import io.github.blockir.core.ext.ExtHolder;
import io.github.blockir.core.ops.Op;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A single instruction of the IR.
 * <p>
 * A node owns the child blocks its {@link NodeKind kind} calls for. They are created
 * together with the node and cannot be swapped out, only filled.
 */
public final class Node extends ExtHolder {
    /**
     * Whether nodes should remember where they were constructed. Useful for tracking
     * down where a malformed graph was built.
     */
    public static boolean TRACK_NODE_CREATIONS = System.getenv("BLOCKIR_TRACK_NODE_CREATIONS") != null;

    /**
     * Where this node was constructed, if {@link #TRACK_NODE_CREATIONS} was set at the time.
     */
    @Nullable
    public final Throwable created = TRACK_NODE_CREATIONS ? new Throwable("constructed") : null;

    private final Op op;
    private final List<Block> blocks;

    /**
     * Construct a detached node, along with its (empty) child blocks.
     *
     * @param op The operation of the node.
     */
    public Node(Op op) {
        this.op = op;
        Block[] children = new Block[op.key.kind.blockCount()];
        for (int i = 0; i < children.length; i++) {
            children[i] = new Block();
            children[i].attachExt(CommonExts.OWNING_NODE, this);
        }
        blocks = Collections.unmodifiableList(Arrays.asList(children));
    }

    public Op getOp() {
        return op;
    }

    public NodeKind getKind() {
        return op.key.kind;
    }

    /**
     * Get the child blocks of this node, in order. For a {@link NodeKind#CONDITIONAL conditional}
     * this is the then-block followed by the else-block.
     *
     * @return The unmodifiable list of child blocks.
     */
    public List<Block> getBlocks() {
        return blocks;
    }

    /**
     * Get one of the child blocks of this node.
     *
     * @param index The index of the block.
     * @return The block.
     * @throws IndexOutOfBoundsException If the node has no such block.
     */
    public Block getBlock(int index) {
        return blocks.get(index);
    }

    /**
     * Get the block this node sits in.
     *
     * @return The block, or null if the node is detached.
     */
    @Nullable
    public Block getOwningBlock() {
        return owner;
    }

    @Override
    public String toString() {
        return op.toString();
    }

    // exts
    private Block owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (Block) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
