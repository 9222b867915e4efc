package io.github.blockir.core.ir;

/**
 * The structural kind of a {@link Node}, deciding how many child blocks it owns.
 */
public enum NodeKind {
    /**
     * An ordinary instruction, with no child blocks.
     */
    PLAIN(0),
    /**
     * A two-way branch, owning a then-block followed by an else-block.
     */
    CONDITIONAL(2),
    /**
     * A loop or scoped region, owning a single body block.
     */
    REGION(1),
    ;

    private final int blockCount;

    NodeKind(int blockCount) {
        this.blockCount = blockCount;
    }

    /**
     * Get the number of child blocks every node of this kind owns.
     *
     * @return The number of child blocks.
     */
    public int blockCount() {
        return blockCount;
    }

    /**
     * Get whether nodes of this kind own any child blocks.
     *
     * @return Whether nodes of this kind own child blocks.
     */
    public boolean hasBlocks() {
        return blockCount != 0;
    }
}
