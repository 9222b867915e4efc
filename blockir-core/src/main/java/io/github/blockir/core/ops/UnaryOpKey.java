package io.github.blockir.core.ops;

import io.github.blockir.core.ir.NodeKind;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A key for plain operations that carry a single immediate argument.
 *
 * @param <T> The type of the argument.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic, NodeKind.PLAIN);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public class UnaryOp extends Op {
        public final T arg;

        private UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    @Nullable
    public UnaryOp checkNullable(Op op) {
        if (op.key != this) return null;
        @SuppressWarnings("unchecked")
        UnaryOp ret = (UnaryOp) op;
        return ret;
    }

    public Optional<UnaryOp> check(Op op) {
        return Optional.ofNullable(checkNullable(op));
    }

    @Nullable
    public T argNullable(Op op) {
        UnaryOp unary = checkNullable(op);
        return unary == null ? null : unary.arg;
    }

    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Argument of " + mnemonic + " is null");
        }
        return new UnaryOp(arg);
    }
}
