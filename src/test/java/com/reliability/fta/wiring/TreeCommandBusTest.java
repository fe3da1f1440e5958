package com.reliability.fta.wiring;

import com.reliability.fta.FaultTreeAnalysis;
import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.TreeValidationException;
import com.reliability.fta.io.TreeDocument;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class TreeCommandBusTest {

    private FaultTreeAnalysis analysis;
    private TreeCommandBus bus;

    @Before
    public void setUp() {
        analysis = new FaultTreeAnalysis();
        bus = new TreeCommandBus(analysis, 64);
    }

    @After
    public void tearDown() {
        bus.close();
    }

    private static TreeDocument.NodeDef node(String id, double p) {
        TreeDocument.NodeDef def = new TreeDocument.NodeDef();
        def.setId(id);
        def.setName(id);
        def.setProbability(p);
        return def;
    }

    private static <T> T get(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testInsertGeneratesMissingId() throws Exception {
        TreeDocument.NodeDef first = get(bus.insert("root", node(null, 0.5)));
        TreeDocument.NodeDef second = get(bus.insert("root", node("", 0.4)));

        assertEquals("root_0", first.getId());
        assertEquals("root_1", second.getId());
        assertEquals(Double.valueOf(0.4), second.getCalculatedProbability());
        assertEquals(0.7, get(bus.query(a -> a.root().getCalculatedProbability())), 0.0);
    }

    @Test
    public void testInsertUnderUnknownParentCompletesWithNull() throws Exception {
        assertNull(get(bus.insert("nowhere", node("x", 0.5))));
        assertEquals(Integer.valueOf(1), get(bus.query(a -> a.store().size())));
    }

    @Test
    public void testUpdateDeleteAndMode() throws Exception {
        get(bus.insert("root", node("a", 0.5)));
        get(bus.insert("a", node("b", 0.5)));

        TreeDocument.NodeDef patch = new TreeDocument.NodeDef();
        patch.setProbability(0.8);
        TreeDocument.NodeDef updated = get(bus.update("b", patch));
        assertEquals(Double.valueOf(0.8), updated.getProbability());
        assertEquals("b", updated.getName());
        assertNull(get(bus.update("ghost", patch)));

        assertEquals(AnalysisMode.ETA, get(bus.setMode(AnalysisMode.ETA)));
        assertEquals(0.4, get(bus.query(a -> a.find("b").getCalculatedProbability())), 0.0);

        assertTrue(get(bus.delete("a")));
        assertFalse(get(bus.delete("a")));
        assertEquals(Integer.valueOf(1), get(bus.query(a -> a.store().size())));
    }

    @Test
    public void testValidationErrorCompletesExceptionallyAndBusKeepsRunning() throws Exception {
        try {
            get(bus.insert("root", node("bad", 1.5)));
            fail("Expected failure");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof TreeValidationException);
        }

        assertNotNull(get(bus.insert("root", node("good", 0.5))));
    }

    @Test
    public void testConcurrentProducersAreSerialized() throws Exception {
        List<Thread> threads = new ArrayList<>();
        List<List<CompletableFuture<TreeDocument.NodeDef>>> replies = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            List<CompletableFuture<TreeDocument.NodeDef>> own = new ArrayList<>();
            replies.add(own);
            final int thread = t;
            threads.add(new Thread(() -> {
                for (int i = 0; i < 25; i++)
                    own.add(bus.insert("root", node("n" + thread + "_" + i, 0.01)));
            }));
        }
        for (Thread thread : threads)
            thread.start();
        for (Thread thread : threads)
            thread.join();

        for (List<CompletableFuture<TreeDocument.NodeDef>> own : replies) {
            for (CompletableFuture<TreeDocument.NodeDef> reply : own)
                assertNotNull(get(reply));
        }
        assertEquals(Integer.valueOf(101), get(bus.query(a -> a.store().size())));
        assertEquals(Long.valueOf(101), get(bus.query(a -> a.passCount())));
    }
}
