package io.github.blockir.core.ops;

import io.github.blockir.core.ir.NodeKind;

/**
 * An operation key, naming a type of operation without any of its immediate arguments.
 * <p>
 * The key decides the {@link NodeKind} of every node built from it.
 */
public abstract class OpKey {
    public final String mnemonic;
    public final NodeKind kind;

    protected OpKey(String mnemonic, NodeKind kind) {
        this.mnemonic = mnemonic;
        this.kind = kind;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
