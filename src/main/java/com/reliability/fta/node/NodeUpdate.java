package com.reliability.fta.node;

import com.reliability.fta.api.LogicGate;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * A field-merge patch for an existing node. {@code null} fields are left
 * untouched. The id and the owned children cannot be patched: structural
 * changes go through insert and delete.
 */
@Data
public final class NodeUpdate {
    private String name;
    private String type;
    private Double probability;
    private LogicGate logicGate;
    private String notes;
    private List<EventLink> links;

    public static NodeUpdate probability(double probability) {
        NodeUpdate u = new NodeUpdate();
        u.setProbability(probability);
        return u;
    }

    public static NodeUpdate gate(LogicGate gate) {
        NodeUpdate u = new NodeUpdate();
        u.setLogicGate(gate);
        return u;
    }

    public static NodeUpdate links(List<EventLink> links) {
        NodeUpdate u = new NodeUpdate();
        u.setLinks(new ArrayList<>(links));
        return u;
    }

    /**
     * Validates the whole patch first and only then writes, so a rejected
     * update leaves the node unchanged.
     */
    public void applyTo(EventNode node) {
        if (probability != null)
            EventNode.checkProbability(node.getId(), probability);
        EventNode.checkLinks(node.getId(), links);

        if (name != null)
            node.setName(name);
        if (type != null)
            node.setType(type);
        if (probability != null)
            node.setProbability(probability);
        if (logicGate != null)
            node.setLogicGate(logicGate);
        if (notes != null)
            node.setNotes(notes);
        if (links != null)
            node.setLinks(links);
    }
}
