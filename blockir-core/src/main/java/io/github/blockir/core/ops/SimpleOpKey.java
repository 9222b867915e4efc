package io.github.blockir.core.ops;

import io.github.blockir.core.ir.NodeKind;

public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic, NodeKind kind) {
        super(mnemonic, kind);
    }

    public SimpleOpKey(String mnemonic) {
        this(mnemonic, NodeKind.PLAIN);
    }

    public Op create() {
        return op;
    }
}
