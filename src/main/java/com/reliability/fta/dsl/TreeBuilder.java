package com.reliability.fta.dsl;

import com.reliability.fta.FaultTreeAnalysis;
import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.LogicGate;
import com.reliability.fta.api.TreeValidationException;
import com.reliability.fta.node.EventLink;
import com.reliability.fta.node.EventNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Tree Builder -- fluent API for defining a tree in code.
 *
 * Usage Pattern:
 * 1. Create a builder: TreeBuilder t = TreeBuilder.create("Pump failure");
 * 2. Define the top event: t.root("top", "Pump fails", LogicGate.AND);
 * 3. Add causes: t.event("top", "seal", "Seal leak", 0.02);
 * 4. Add intermediate gates: t.gate("top", "power", "No power", LogicGate.OR);
 * 5. Cross-link: t.link("seal", "power", LogicGate.OR);
 * 6. Build: FaultTreeAnalysis fta = t.build();
 *
 * Unlike the store, the builder is strict: an unknown parent is an error
 * rather than a silent no-op. Link targets may be declared later, or never
 * (they then dangle and are skipped at evaluation).
 */
public final class TreeBuilder {
    private final String title;
    private final Map<String, EventNode> nodesById = new HashMap<>();
    private EventNode root;
    private AnalysisMode mode = AnalysisMode.FTA;

    // Flag to prevent modification after building
    private boolean built;

    private TreeBuilder(String title) {
        this.title = title;
    }

    public static TreeBuilder create(String title) {
        return new TreeBuilder(title);
    }

    // ── Structure ────────────────────────────────────────────────

    /** Declares the top event as a plain event with its own probability. */
    public TreeBuilder root(String id, String name, double probability) {
        return setRoot(new EventNode(id, name, "Root", probability, LogicGate.OR, ""));
    }

    /** Declares the top event as a gate combining its children. */
    public TreeBuilder root(String id, String name, LogicGate gate) {
        return setRoot(new EventNode(id, name, "Root", 1.0, gate, ""));
    }

    private TreeBuilder setRoot(EventNode node) {
        checkNotBuilt();
        if (root != null)
            throw new IllegalStateException("Root already defined: " + root.getId());
        root = node;
        nodesById.put(node.getId(), node);
        return this;
    }

    /** Adds a basic event under {@code parentId}. */
    public TreeBuilder event(String parentId, String id, String name, double probability) {
        return attach(parentId, new EventNode(id, name, probability));
    }

    /** Adds an intermediate gate under {@code parentId}. */
    public TreeBuilder gate(String parentId, String id, String name, LogicGate gate) {
        return attach(parentId, new EventNode(id, name, "Gate", 1.0, gate, ""));
    }

    private TreeBuilder attach(String parentId, EventNode node) {
        checkNotBuilt();
        EventNode parent = requireNode(parentId);
        if (nodesById.containsKey(node.getId()))
            throw new TreeValidationException("Duplicate node id: '" + node.getId() + "'");
        parent.addChild(node);
        nodesById.put(node.getId(), node);
        return this;
    }

    /** Declares a cross-link; the target does not have to exist. */
    public TreeBuilder link(String fromId, String targetId, LogicGate relation) {
        checkNotBuilt();
        requireNode(fromId).addLink(new EventLink(targetId, relation));
        return this;
    }

    public TreeBuilder notes(String id, String notes) {
        checkNotBuilt();
        requireNode(id).setNotes(notes);
        return this;
    }

    public TreeBuilder mode(AnalysisMode mode) {
        checkNotBuilt();
        this.mode = mode;
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    /** Builds and evaluates the analysis. The builder cannot be reused. */
    public FaultTreeAnalysis build() {
        checkNotBuilt();
        built = true;
        var analysis = new FaultTreeAnalysis(root != null ? root : EventNode.defaultRoot(), mode);
        if (title != null)
            analysis.setTitle(title);
        return analysis;
    }

    private EventNode requireNode(String id) {
        EventNode node = nodesById.get(id);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return node;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Tree already built");
    }
}
