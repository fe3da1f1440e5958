package com.reliability.fta.node;

import com.reliability.fta.api.LogicGate;

/**
 * Non-hierarchical cross-reference from one node to another.
 *
 * The target is held by id only and resolved by lookup when a pass runs, so a
 * link outlives the deletion of its target (it is then skipped).
 */
public record EventLink(String targetId, LogicGate relation) {

    public EventLink {
        if (relation == null)
            relation = LogicGate.OR;
    }

    public static EventLink and(String targetId) {
        return new EventLink(targetId, LogicGate.AND);
    }

    public static EventLink or(String targetId) {
        return new EventLink(targetId, LogicGate.OR);
    }

    /** Blank targets are never looked up. */
    public boolean hasTarget() {
        return targetId != null && !targetId.isEmpty();
    }
}
