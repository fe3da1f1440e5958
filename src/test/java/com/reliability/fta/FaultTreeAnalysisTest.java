package com.reliability.fta;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.LogicGate;
import com.reliability.fta.node.EventLink;
import com.reliability.fta.node.EventNode;
import com.reliability.fta.node.NodeUpdate;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.Assert.*;

public class FaultTreeAnalysisTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final String TODAY = "2024-05-01";

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private FaultTreeAnalysis analysis;

    @Before
    public void setUp() {
        // top(AND, p=0.5)
        // ├── x(0.8)
        // └── y(0.6)
        EventNode top = new EventNode("top", "Top", "Root", 0.5, LogicGate.AND, "");
        top.addChild(new EventNode("x", "X", 0.8));
        top.addChild(new EventNode("y", "Y", 0.6));
        analysis = new FaultTreeAnalysis(top, AnalysisMode.FTA, CLOCK);
    }

    private double calc(String id) {
        return analysis.find(id).getCalculatedProbability();
    }

    @Test
    public void testConstructionEvaluates() {
        assertEquals(0.48, calc("top"), 0.0);
        assertEquals(1, analysis.passCount());
        assertEquals(FaultTreeAnalysis.DEFAULT_TITLE, analysis.title());
        assertEquals(TODAY, analysis.date());
    }

    @Test
    public void testModeSwitchRecalculates() {
        analysis.setMode(AnalysisMode.ETA);

        assertEquals(0.5, calc("top"), 0.0);
        assertEquals(0.4, calc("x"), 0.0);
        assertEquals(0.3, calc("y"), 0.0);

        analysis.setMode(AnalysisMode.FTA);
        assertEquals(0.48, calc("top"), 0.0);
        assertEquals(3, analysis.passCount());
    }

    @Test
    public void testMutationsRecalculate() {
        assertTrue(analysis.insert("top", new EventNode("z", "Z", 0.5)));
        assertEquals(0.24, calc("top"), 0.0);

        assertTrue(analysis.update("z", NodeUpdate.probability(0.25)));
        assertEquals(0.12, calc("top"), 0.0);

        assertTrue(analysis.delete("z"));
        assertEquals(0.48, calc("top"), 0.0);

        assertFalse(analysis.insert("ghost", new EventNode("w", "W", 0.5)));
        assertNull(analysis.find("w"));
        assertEquals(5, analysis.passCount());
    }

    @Test
    public void testLinkUpdateRecalculates() {
        assertTrue(analysis.update("x", NodeUpdate.links(List.of(EventLink.and("y")))));

        assertEquals(0.48, calc("x"), 0.0);
        assertEquals(0.288, calc("top"), 0.0);
    }

    @Test
    public void testZeroProbabilitySet() {
        EventNode root = new EventNode("root", "Root", "Root", 1.0, LogicGate.OR, "");
        root.addChild(new EventNode("a", "A", 0.0));
        root.addChild(new EventNode("b", "B", 0.5));
        EventNode c = new EventNode("c", "C", 0.3);
        c.addLink(EventLink.and("a"));
        root.addChild(c);
        FaultTreeAnalysis fta = new FaultTreeAnalysis(root, AnalysisMode.FTA, CLOCK);

        assertEquals(List.of("a", "c"), List.copyOf(fta.zeroProbabilityNodes()));
        assertEquals(0.5, fta.find("root").getCalculatedProbability(), 0.0);

        fta.update("a", NodeUpdate.probability(0.5));
        assertTrue(fta.zeroProbabilityNodes().isEmpty());
    }

    @Test
    public void testMetadataRefreshesDate() {
        analysis.setDate("2000-01-01");
        analysis.setMetadata("Pump", null, null);
        assertEquals("Pump", analysis.title());
        assertEquals(TODAY, analysis.date());

        analysis.setMetadata(null, "2010-10-10", null);
        assertEquals("Pump", analysis.title());
        assertEquals("2010-10-10", analysis.date());

        analysis.setMetadata(null, null, AnalysisMode.ETA);
        assertEquals(AnalysisMode.ETA, analysis.mode());
        assertEquals(TODAY, analysis.date());
        assertEquals(0.5, calc("top"), 0.0);
    }

    @Test(expected = IllegalStateException.class)
    public void testSaveWithoutPathFails() throws Exception {
        analysis.save();
    }

    @Test
    public void testSaveAndLoadRoundTrip() throws Exception {
        analysis.find("x").addLink(EventLink.or("y"));
        analysis.setMetadata("Pump failure", "", AnalysisMode.FTA);
        Path file = tmp.getRoot().toPath().resolve("pump.json");

        analysis.save(file);

        assertEquals(file, analysis.lastSavedFile());
        assertEquals(TODAY, analysis.date());
        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"calculatedProbability\""));
        assertTrue(json.contains("\"target_id\" : \"y\""));

        FaultTreeAnalysis loaded = new FaultTreeAnalysis(EventNode.defaultRoot(), AnalysisMode.ETA, CLOCK);
        loaded.load(file);

        assertEquals("Pump failure", loaded.title());
        assertEquals(TODAY, loaded.date());
        assertEquals(AnalysisMode.FTA, loaded.mode());
        assertEquals(file, loaded.lastSavedFile());
        assertEquals(analysis.flattenPreorder(), loaded.flattenPreorder());
        assertEquals(calc("top"), loaded.find("top").getCalculatedProbability(), 0.0);
    }

    @Test
    public void testExportedDocumentIsDetached() {
        var doc = analysis.toDocument();
        analysis.update("x", NodeUpdate.probability(0.1));

        assertEquals(0.48, doc.getTree().getCalculatedProbability(), 0.0);
        assertEquals(0.8, doc.getTree().getChildren().get(0).getProbability(), 0.0);
    }

    @Test
    public void testLegacyLoadResetsMetadata() throws Exception {
        analysis.setTitle("Custom");
        analysis.setMode(AnalysisMode.ETA);

        analysis.loadString("{\"FTA\": {\"id\": \"r\", \"logicGate\": \"AND\","
                + " \"children\": [{\"probability\": 0.5}, {\"probability\": 0.5}]}}");

        assertEquals(FaultTreeAnalysis.DEFAULT_TITLE, analysis.title());
        assertEquals(AnalysisMode.FTA, analysis.mode());
        assertEquals(0.25, analysis.find("r").getCalculatedProbability(), 0.0);
        assertNotNull(analysis.find("r_1"));
    }

    @Test
    public void testNewAnalysisResets() throws Exception {
        analysis.setTitle("Custom");
        analysis.save(tmp.getRoot().toPath().resolve("a.json"));

        analysis.newAnalysis();

        assertEquals(FaultTreeAnalysis.DEFAULT_TITLE, analysis.title());
        assertEquals(AnalysisMode.FTA, analysis.mode());
        assertNull(analysis.lastSavedFile());
        assertEquals(1, analysis.store().size());
        assertEquals("root", analysis.root().getId());
        assertEquals(1.0, analysis.root().getCalculatedProbability(), 0.0);
    }
}
