package com.reliability.fta.node;

import com.reliability.fta.api.LogicGate;
import com.reliability.fta.api.TreeValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import lombok.Getter;

/**
 * An event in a fault or event tree.
 *
 * A node exclusively owns its children; links are weak references to other
 * nodes by id and are resolved through the {@code NodeStore} at evaluation
 * time, so a link may point at an ancestor, at the node itself, or at an id
 * that no longer exists.
 *
 * Field values are validated on the way in. {@code calculatedProbability} is
 * output only: it stays {@code null} until the first recalculation and is
 * written exclusively by an evaluator.
 */
@Getter
public final class EventNode {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final String DEFAULT_TYPE = "Event";

    private final String id;
    private String name;
    private String type;
    private double probability;
    private LogicGate logicGate;
    private String notes;
    private final List<EventNode> children = new ArrayList<>();
    private final List<EventLink> links = new ArrayList<>();
    private Double calculatedProbability;

    public EventNode(String id, String name, double probability) {
        this(id, name, DEFAULT_TYPE, probability, LogicGate.OR, "");
    }

    public EventNode(String id, String name, String type, double probability, LogicGate logicGate, String notes) {
        if (id == null || id.isEmpty())
            throw new TreeValidationException("Node id must not be empty");
        this.id = id;
        setName(name);
        setType(type);
        setProbability(probability);
        setLogicGate(logicGate);
        setNotes(notes);
    }

    /** The default single root a new analysis starts from. */
    public static EventNode defaultRoot() {
        return new EventNode("root", "RootEvent", "Root", 1.0, LogicGate.OR, "");
    }

    /** Collapses whitespace runs to one space and trims. {@code null} becomes empty. */
    public static String sanitizeName(String raw) {
        if (raw == null)
            return "";
        return WHITESPACE.matcher(raw).replaceAll(" ").trim();
    }

    /**
     * @throws TreeValidationException unless {@code p} is a finite value in [0, 1].
     */
    public static void checkProbability(String nodeId, double p) {
        if (!Double.isFinite(p) || p < 0.0 || p > 1.0)
            throw new TreeValidationException(
                    "Probability of node '" + nodeId + "' must be within [0, 1], was " + p);
    }

    public void setName(String name) {
        this.name = sanitizeName(name);
    }

    public void setType(String type) {
        this.type = type == null ? DEFAULT_TYPE : type;
    }

    public void setProbability(double probability) {
        checkProbability(id, probability);
        this.probability = probability;
    }

    public void setLogicGate(LogicGate logicGate) {
        this.logicGate = logicGate == null ? LogicGate.OR : logicGate;
    }

    public void setNotes(String notes) {
        this.notes = notes == null ? "" : notes;
    }

    /**
     * @throws TreeValidationException if any entry is null.
     */
    public static void checkLinks(String nodeId, List<EventLink> links) {
        if (links == null)
            return;
        for (EventLink link : links) {
            if (link == null)
                throw new TreeValidationException("Links of node '" + nodeId + "' must not contain null");
        }
    }

    /** Replaces all links, keeping declaration order. Rejected lists leave the links unchanged. */
    public void setLinks(List<EventLink> links) {
        checkLinks(id, links);
        this.links.clear();
        if (links != null) {
            for (EventLink link : links)
                addLink(link);
        }
    }

    public void addLink(EventLink link) {
        if (link == null)
            throw new TreeValidationException("Link of node '" + id + "' must not be null");
        links.add(link);
    }

    public List<EventLink> getLinks() {
        return Collections.unmodifiableList(links);
    }

    public List<EventNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /** Appends {@code child} as the last owned child. */
    public void addChild(EventNode child) {
        children.add(child);
    }

    /**
     * Drops every direct child whose id equals {@code childId}, together with
     * its owned subtree.
     *
     * @return true if at least one child was removed.
     */
    public boolean removeChildren(String childId) {
        return children.removeIf(c -> c.id.equals(childId));
    }

    /** Evaluator output. Values are already rounded by the caller. */
    public void assignCalculatedProbability(double value) {
        this.calculatedProbability = value;
    }

    @Override
    public String toString() {
        return "EventNode[" + id + ", '" + name + "', p=" + probability + ", gate=" + logicGate
                + ", children=" + children.size() + ", links=" + links.size()
                + ", calc=" + calculatedProbability + "]";
    }
}
