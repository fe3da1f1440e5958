package com.reliability.fta.dsl;

import com.reliability.fta.FaultTreeAnalysis;
import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.LogicGate;
import com.reliability.fta.api.TreeValidationException;
import org.junit.Test;

import static org.junit.Assert.*;

public class TreeBuilderTest {

    private static TreeBuilder pump() {
        return TreeBuilder.create("Pump failure")
                .root("top", "Pump fails", LogicGate.AND)
                .event("top", "seal", "Seal leak", 0.5)
                .gate("top", "power", "No power", LogicGate.OR)
                .event("power", "grid", "Grid loss", 0.2)
                .event("power", "diesel", "Diesel fails", 0.5);
    }

    @Test
    public void testBuildEvaluatesTree() {
        FaultTreeAnalysis fta = pump().build();

        assertEquals("Pump failure", fta.title());
        assertEquals(AnalysisMode.FTA, fta.mode());
        assertEquals(0.6, fta.find("power").getCalculatedProbability(), 0.0);
        assertEquals(0.3, fta.find("top").getCalculatedProbability(), 0.0);
    }

    @Test
    public void testLinksAndNotes() {
        FaultTreeAnalysis fta = pump()
                .link("seal", "grid", LogicGate.AND)
                .link("diesel", "later", LogicGate.OR)
                .notes("seal", "Checked yearly")
                .build();

        assertEquals(0.1, fta.find("seal").getCalculatedProbability(), 0.0);
        assertEquals("Checked yearly", fta.find("seal").getNotes());
        // Dangling link leaves diesel at its base value
        assertEquals(0.5, fta.find("diesel").getCalculatedProbability(), 0.0);
    }

    @Test
    public void testEtaMode() {
        FaultTreeAnalysis fta = TreeBuilder.create("Chain")
                .root("root", "Initiator", 0.5)
                .event("root", "branch", "Branch", 0.8)
                .event("branch", "outcome", "Outcome", 0.9)
                .mode(AnalysisMode.ETA)
                .build();

        assertEquals(0.36, fta.find("outcome").getCalculatedProbability(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownParentFails() {
        pump().event("nowhere", "x", "X", 0.1);
    }

    @Test(expected = TreeValidationException.class)
    public void testDuplicateIdFails() {
        pump().event("power", "seal", "Seal again", 0.1);
    }

    @Test(expected = TreeValidationException.class)
    public void testInvalidProbabilityFails() {
        pump().event("power", "bad", "Bad", 1.2);
    }

    @Test(expected = IllegalStateException.class)
    public void testCannotModifyAfterBuild() {
        TreeBuilder builder = pump();
        builder.build();
        builder.event("top", "late", "Late", 0.1);
    }

    @Test
    public void testEmptyBuilderYieldsDefaultRoot() {
        FaultTreeAnalysis fta = TreeBuilder.create("Blank").build();

        assertEquals("root", fta.root().getId());
        assertEquals(1.0, fta.root().getCalculatedProbability(), 0.0);
    }
}
