package com.reliability.fta.engine;

import com.reliability.fta.api.LogicGate;
import com.reliability.fta.api.TreeValidationException;
import com.reliability.fta.io.TreeDocument;
import com.reliability.fta.node.EventLink;
import com.reliability.fta.node.EventNode;
import com.reliability.fta.node.NodeSummary;
import com.reliability.fta.node.NodeUpdate;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class NodeStoreTest {

    private NodeStore store;

    @Before
    public void setUp() {
        // root
        // ├── a
        // │   ├── a1
        // │   └── a2
        // └── b
        store = new NodeStore();
        store.insert("root", new EventNode("a", "A", 0.5));
        store.insert("a", new EventNode("a1", "A1", 0.1));
        store.insert("a", new EventNode("a2", "A2", 0.2));
        store.insert("root", new EventNode("b", "B", 0.3));
    }

    @Test
    public void testFlattenIsPreorder() {
        List<NodeSummary> flat = store.flattenPreorder();

        assertEquals(5, flat.size());
        assertEquals(new NodeSummary("root", "RootEvent"), flat.get(0));
        assertEquals(List.of("root", "a", "a1", "a2", "b"),
                flat.stream().map(NodeSummary::id).toList());
        assertEquals(5, store.size());
    }

    @Test
    public void testFindAndParent() {
        assertEquals("A2", store.find("a2").getName());
        assertNull(store.find("zzz"));
        assertNull(store.find(null));
        assertEquals("a", store.findParent("a2").getId());
        assertNull(store.findParent("root"));
    }

    @Test
    public void testInsertUnderUnknownParentIsNoOp() {
        assertFalse(store.insert("nowhere", new EventNode("c", "C", 0.1)));
        assertFalse(store.contains("c"));
        assertEquals(5, store.size());
    }

    @Test(expected = TreeValidationException.class)
    public void testInsertRejectsDuplicateId() {
        store.insert("b", new EventNode("a1", "Again", 0.1));
    }

    @Test
    public void testDeleteRemovesSubtree() {
        assertTrue(store.delete("a"));

        assertNull(store.find("a"));
        assertNull(store.find("a1"));
        assertNull(store.find("a2"));
        assertEquals(List.of("root", "b"), store.flattenPreorder().stream().map(NodeSummary::id).toList());
    }

    @Test
    public void testDeleteUnknownOrRootChangesNothing() {
        assertFalse(store.delete("ghost"));
        assertFalse(store.delete("root"));
        assertEquals(5, store.size());
    }

    @Test
    public void testUpdateMergesFields() {
        NodeUpdate update = NodeUpdate.probability(0.25);
        update.setName("  Renamed\n node ");
        update.setLinks(List.of(EventLink.and("b")));

        assertTrue(store.update("a1", update));

        EventNode a1 = store.find("a1");
        assertEquals(0.25, a1.getProbability(), 0.0);
        assertEquals("Renamed node", a1.getName());
        assertEquals(List.of(EventLink.and("b")), a1.getLinks());
        assertEquals("Event", a1.getType());
        assertFalse(store.update("ghost", NodeUpdate.gate(LogicGate.AND)));
    }

    @Test
    public void testRejectedUpdateLeavesNodeUnchanged() {
        NodeUpdate update = NodeUpdate.probability(1.5);
        update.setName("Should not stick");
        try {
            store.update("a1", update);
            fail("Expected TreeValidationException");
        } catch (TreeValidationException e) {
            assertEquals("A1", store.find("a1").getName());
            assertEquals(0.1, store.find("a1").getProbability(), 0.0);
        }
    }

    @Test
    public void testNullLinkIsRejectedBeforeEvaluation() {
        NodeUpdate update = NodeUpdate.probability(0.9);
        update.setLinks(Arrays.asList(EventLink.or("b"), null));
        try {
            store.update("a1", update);
            fail("Expected TreeValidationException");
        } catch (TreeValidationException e) {
            assertEquals(0.1, store.find("a1").getProbability(), 0.0);
            assertTrue(store.find("a1").getLinks().isEmpty());
        }

        EventNode b = store.find("b");
        b.addLink(EventLink.and("a"));
        try {
            b.addLink(null);
            fail("Expected TreeValidationException");
        } catch (TreeValidationException e) {
            assertEquals(List.of(EventLink.and("a")), b.getLinks());
        }

        int evaluated = new FtaEvaluator().recalculate(store, new EvaluationContext(1, null));
        assertEquals(5, evaluated);
    }

    @Test
    public void testNextChildId() {
        assertEquals("b_0", store.nextChildId("b"));

        store.insert("b", new EventNode("b_0", "B0", 0.1));
        store.insert("b", new EventNode("b_4", "B4", 0.1));
        store.insert("b", new EventNode("b_x", "Bx", 0.1));
        assertEquals("b_5", store.nextChildId("b"));
    }

    @Test
    public void testNextChildIdSkipsIdsTakenElsewhere() {
        store.insert("a", new EventNode("b_0", "Elsewhere", 0.1));
        assertEquals("b_1", store.nextChildId("b"));
    }

    @Test
    public void testNormalizeFillsDefaults() {
        TreeDocument.NodeDef raw = new TreeDocument.NodeDef();
        TreeDocument.NodeDef child = new TreeDocument.NodeDef();
        child.setProbability(0.3);
        child.setLogicGate(" and ");
        child.setLinks(List.of(new TreeDocument.LinkDef("x", null)));
        raw.setChildren(List.of(child));

        EventNode node = NodeStore.normalizeRoot(raw);

        assertEquals("root_0", node.getId());
        assertEquals("Node_root_0", node.getName());
        assertEquals(1.0, node.getProbability(), 0.0);
        assertEquals(LogicGate.OR, node.getLogicGate());
        assertEquals("Event", node.getType());
        assertEquals("", node.getNotes());

        EventNode normalizedChild = node.getChildren().get(0);
        assertEquals("root_0_0", normalizedChild.getId());
        assertEquals(LogicGate.AND, normalizedChild.getLogicGate());
        assertEquals(List.of(EventLink.or("x")), normalizedChild.getLinks());
        assertNull(normalizedChild.getCalculatedProbability());
    }

    @Test(expected = TreeValidationException.class)
    public void testNormalizeRejectsUnknownGate() {
        TreeDocument.NodeDef raw = new TreeDocument.NodeDef();
        raw.setId("r");
        raw.setLogicGate("XOR");
        NodeStore.normalizeRoot(raw);
    }

    @Test(expected = TreeValidationException.class)
    public void testReplaceRootRejectsRepeatedIds() {
        EventNode root = new EventNode("r", "R", 1.0);
        root.addChild(new EventNode("dup", "One", 0.1));
        root.addChild(new EventNode("dup", "Two", 0.1));
        store.replaceRoot(root);
    }
}
