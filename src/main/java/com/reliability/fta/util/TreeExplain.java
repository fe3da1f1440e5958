package com.reliability.fta.util;

import com.reliability.fta.api.ProbabilityBand;
import com.reliability.fta.engine.NodeStore;
import com.reliability.fta.node.EventLink;
import com.reliability.fta.node.EventNode;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Diagnostic utility for inspecting an evaluated tree.
 *
 * <p>
 * Produces human-readable dumps and the Mermaid source handed to the external
 * diagram renderer. Ownership edges are solid and unlabeled; link edges are
 * dashed and labeled with their relation. Each node gets a
 * {@link ProbabilityBand} class, and gates show in the node label.
 *
 * <p>
 * Reads calculated probabilities as they are; never triggers a pass.
 */
public final class TreeExplain {
    private final NodeStore store;

    public TreeExplain(NodeStore store) {
        this.store = store;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeId) {
        EventNode node = store.find(nodeId);
        if (node == null)
            return "Node: " + nodeId + " (not found)\n";
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.getId()).append('\n')
                .append("  Name: ").append(node.getName()).append('\n')
                .append("  Type: ").append(node.getType()).append('\n')
                .append("  Base probability: ").append(node.getProbability()).append('\n')
                .append("  Calculated probability: ").append(node.getCalculatedProbability()).append('\n')
                .append("  Band: ").append(ProbabilityBand.of(node.getCalculatedProbability())).append('\n');
        if (node.hasChildren())
            sb.append("  Gate: ").append(node.getLogicGate()).append('\n');
        if (!node.getNotes().isEmpty())
            sb.append("  Notes: ").append(node.getNotes()).append('\n');

        int cc = node.getChildren().size();
        sb.append("  Children (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(node.getChildren().get(i).getId());
            if (i < cc - 1)
                sb.append(", ");
        }
        sb.append('\n');

        int lc = node.getLinks().size();
        sb.append("  Links (").append(lc).append("): ");
        for (int i = 0; i < lc; i++) {
            EventLink l = node.getLinks().get(i);
            EventNode target = l.hasTarget() ? store.find(l.targetId()) : null;
            sb.append(l.relation()).append("->").append(target != null ? target.getName() : l.targetId());
            if (target == null)
                sb.append(" (missing)");
            if (i < lc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the whole tree as an indented outline.
     */
    public String dumpTree() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Tree (").append(store.size()).append(" nodes):\n");
        dump(store.root(), 1, sb);
        return sb.toString();
    }

    private void dump(EventNode node, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(node.getId()).append(" '").append(node.getName()).append("'");
        if (node.hasChildren())
            sb.append(" [").append(node.getLogicGate()).append(']');
        sb.append(" p=").append(node.getProbability())
                .append(" calc=").append(node.getCalculatedProbability());
        for (EventLink l : node.getLinks())
            sb.append(" ~").append(l.relation()).append("~> ").append(l.targetId());
        sb.append('\n');
        for (EventNode child : node.getChildren())
            dump(child, depth + 1, sb);
    }

    /**
     * Generates a Mermaid JS diagram of the evaluated tree.
     *
     * @param hideZero Omit nodes whose calculated probability is exactly 0.0,
     *                 together with their subtrees and any links to them.
     */
    public String toMermaid(boolean hideZero) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Nodes and ownership edges, pre-order
        Set<String> shown = new LinkedHashSet<>();
        declare(store.root(), null, hideZero, shown, sb);

        // 2. Link edges once the visible node set is known
        store.forEachPreorder(node -> {
            if (!shown.contains(node.getId()))
                return;
            for (EventLink l : node.getLinks()) {
                if (!l.hasTarget() || !shown.contains(l.targetId()))
                    continue;
                sb.append("  ").append(sanitize(node.getId())).append(" -. ").append(l.relation())
                        .append(" .-> ").append(sanitize(l.targetId())).append(";\n");
            }
        });

        // 3. Band classes
        for (ProbabilityBand band : ProbabilityBand.values())
            sb.append("  classDef ").append(className(band)).append(" fill:").append(band.color())
                    .append(",stroke:#333;\n");
        return sb.toString();
    }

    private void declare(EventNode node, EventNode parent, boolean hideZero, Set<String> shown, StringBuilder sb) {
        Double calc = node.getCalculatedProbability();
        if (hideZero && calc != null && calc == 0.0)
            return;
        shown.add(node.getId());
        String safe = sanitize(node.getId());

        sb.append("  ").append(safe).append("[\"<b>").append(escape(node.getName())).append("</b><br/>");
        if (node.hasChildren())
            sb.append("Gate: ").append(node.getLogicGate()).append(" | ");
        sb.append("P:").append(format(node.getProbability()))
                .append(" | P_calc:").append(calc == null ? "N/A" : format(calc))
                .append("\"]:::").append(className(ProbabilityBand.of(calc))).append(";\n");

        if (parent != null)
            sb.append("  ").append(sanitize(parent.getId())).append(" --> ").append(safe).append(";\n");

        for (EventNode child : node.getChildren())
            declare(child, node, hideZero, shown, sb);
    }

    private static String className(ProbabilityBand band) {
        return band.name().toLowerCase(Locale.ROOT);
    }

    private static String format(double p) {
        return String.format(Locale.ROOT, "%.3f", p);
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }

    private static String sanitize(String id) {
        return id.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
