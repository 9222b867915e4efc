package io.github.blockir.test;

import io.github.blockir.core.ext.CommonExts;
import io.github.blockir.core.ext.Ext;
import io.github.blockir.core.ext.ExtHolder;
import io.github.blockir.core.ir.Graph;
import io.github.blockir.core.ir.Node;
import io.github.blockir.core.ops.CommonOps;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExtHolderTest {
    private static final List<Ext<Object>> EXTS = Arrays.asList(
            Ext.create(Object.class, "a"),
            Ext.create(Object.class, "b"),
            Ext.create(Object.class, "c")
    );
    private static final Ext<Integer> DEPTH = Ext.create(Integer.class, "DEPTH");

    @Test
    void testAttachAndRemove() {
        ExtHolder eh = new ExtHolder();
        Object[] values = new Object[EXTS.size()];
        for (int i = 0; i < EXTS.size(); i++) {
            values[i] = new Object();
            eh.attachExt(EXTS.get(i), values[i]);
        }
        for (int i = 0; i < EXTS.size(); i++) {
            assertSame(values[i], eh.getNullable(EXTS.get(i)));
            assertSame(values[i], EXTS.get(i).getIn(eh).orElse(null));
        }

        eh.removeExt(EXTS.get(1));
        assertNull(eh.getNullable(EXTS.get(1)));
        assertFalse(eh.getExt(EXTS.get(1)).isPresent());
        assertSame(values[0], eh.getExtOrThrow(EXTS.get(0)));

        for (Ext<Object> ext : EXTS) {
            eh.removeExt(ext);
        }
        eh.removeExt(DEPTH);
        assertThrows(IllegalStateException.class, () -> eh.getExtOrThrow(EXTS.get(0)));
    }

    @Test
    void testExtsAreOrderedByCreation() {
        assertTrue(EXTS.get(0).compareTo(EXTS.get(1)) < 0);
        assertTrue(EXTS.get(2).compareTo(EXTS.get(1)) > 0);
        assertEquals(0, DEPTH.compareTo(DEPTH));
        assertEquals("DEPTH", DEPTH.getName());
        assertEquals(Integer.class, DEPTH.getType());
    }

    @Test
    void testFieldExtsCoexistWithMapExts() {
        Graph graph = new Graph();
        Node node = graph.getBlock().addNode(CommonOps.RETURN.node());
        node.attachExt(DEPTH, 0);

        assertSame(graph.getBlock(), node.getNullable(CommonExts.OWNING_BLOCK));
        assertEquals(0, node.getExtOrThrow(DEPTH));

        node.removeExt(DEPTH);
        assertSame(graph.getBlock(), node.getOwningBlock());
        assertNull(node.getNullable(DEPTH));

        graph.getBlock().attachExt(DEPTH, 1);
        assertEquals(1, graph.getBlock().getExtOrThrow(DEPTH));
        assertSame(graph, graph.getBlock().getGraph());
    }
}
