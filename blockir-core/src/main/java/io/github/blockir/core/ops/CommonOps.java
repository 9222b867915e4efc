package io.github.blockir.core.ops;

import io.github.blockir.core.ir.NodeKind;

/**
 * The operations understood by the IR out of the box.
 */
public class CommonOps {
    /**
     * Conditional: {@code if}, with a then-block and an else-block.
     */
    public static final Op IF = new SimpleOpKey("if", NodeKind.CONDITIONAL).create();
    /**
     * Region: {@code loop}, whose single block is the loop body.
     */
    public static final Op LOOP = new SimpleOpKey("loop", NodeKind.REGION).create();
    /**
     * Region: {@code with}, whose single block is the scoped body.
     */
    public static final Op WITH = new SimpleOpKey("with", NodeKind.REGION).create();

    /**
     * Plain: a constant value.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const");
    /**
     * Plain: a call to the named function.
     */
    public static final UnaryOpKey<String> CALL = new UnaryOpKey<>("call", name -> "@" + name);
    /**
     * Plain: an input of the graph, by index.
     */
    public static final UnaryOpKey<Integer> PARAM = new UnaryOpKey<>("param");
    /**
     * Plain: returns from the graph.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();
}
