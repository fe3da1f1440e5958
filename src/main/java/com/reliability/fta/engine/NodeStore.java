package com.reliability.fta.engine;

import com.reliability.fta.api.LogicGate;
import com.reliability.fta.api.TreeValidationException;
import com.reliability.fta.io.TreeDocument;
import com.reliability.fta.node.EventLink;
import com.reliability.fta.node.EventNode;
import com.reliability.fta.node.NodeSummary;
import com.reliability.fta.node.NodeUpdate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import lombok.extern.log4j.Log4j2;

/**
 * Owns the tree: node storage, lookup, insertion, deletion and id
 * normalization.
 *
 * The hierarchy is a strict ownership tree rooted at {@link #root()}. Lookups
 * are depth-first in pre-order and return the first match, so results are
 * deterministic. Ids are unique across the tree; that is checked whenever
 * nodes enter the store.
 *
 * Structural errors are silent: inserting under an unknown parent or deleting
 * an unknown id changes nothing. The boolean results let callers notice.
 *
 * Thread Safety:
 * Not thread-safe. A recalculation pass owns the store exclusively while it
 * runs; callers serialize mutation against evaluation.
 */
@Log4j2
public final class NodeStore {
    public static final String ROOT_PARENT_HINT = "root";

    private EventNode root;

    public NodeStore() {
        this(EventNode.defaultRoot());
    }

    public NodeStore(EventNode root) {
        replaceRoot(root);
    }

    public EventNode root() {
        return root;
    }

    /**
     * Swaps in a whole new tree.
     *
     * @throws TreeValidationException if the tree repeats an id.
     */
    public void replaceRoot(EventNode newRoot) {
        if (newRoot == null)
            throw new TreeValidationException("Root node must not be null");
        collectIds(newRoot, new HashSet<>());
        this.root = newRoot;
    }

    // ── Lookup ───────────────────────────────────────────────────

    /**
     * Finds a node by id, first match in pre-order.
     *
     * @return The node, or null if not found.
     */
    public EventNode find(String id) {
        if (id == null)
            return null;
        return find(root, id);
    }

    private static EventNode find(EventNode current, String id) {
        if (current.getId().equals(id))
            return current;
        for (EventNode child : current.getChildren()) {
            EventNode hit = find(child, id);
            if (hit != null)
                return hit;
        }
        return null;
    }

    public boolean contains(String id) {
        return find(id) != null;
    }

    /** Finds the direct owner of {@code id}. Null for the root or unknown ids. */
    public EventNode findParent(String id) {
        if (id == null)
            return null;
        return findParent(root, id);
    }

    private static EventNode findParent(EventNode current, String id) {
        for (EventNode child : current.getChildren()) {
            if (child.getId().equals(id))
                return current;
            EventNode hit = findParent(child, id);
            if (hit != null)
                return hit;
        }
        return null;
    }

    // ── Mutation ─────────────────────────────────────────────────

    /**
     * Appends {@code node} (with any subtree it already owns) as the last child
     * of the node found by {@code parentId}.
     *
     * An unresolvable parent is a silent no-op: the node is discarded.
     *
     * @return true if the node was attached.
     * @throws TreeValidationException if any id in the new subtree is already
     *                                 used, or is repeated within it.
     */
    public boolean insert(String parentId, EventNode node) {
        EventNode parent = find(parentId);
        if (parent == null) {
            log.debug("Insert of '{}' ignored: parent '{}' not found", node.getId(), parentId);
            return false;
        }
        Set<String> existing = new HashSet<>();
        collectIds(root, existing);
        Set<String> incoming = new HashSet<>();
        collectIds(node, incoming);
        for (String id : incoming) {
            if (existing.contains(id))
                throw new TreeValidationException("Duplicate node id: '" + id + "'");
        }
        parent.addChild(node);
        return true;
    }

    /**
     * Removes every direct child matching {@code id} anywhere in the tree,
     * together with its owned subtree. The root itself is never removed.
     *
     * @return true if something was removed.
     */
    public boolean delete(String id) {
        if (id == null)
            return false;
        return delete(root, id);
    }

    private static boolean delete(EventNode current, String id) {
        boolean removed = current.removeChildren(id);
        for (EventNode child : current.getChildren())
            removed |= delete(child, id);
        return removed;
    }

    /**
     * Merges {@code fields} into the node found by {@code id}.
     *
     * @return true if the node existed.
     * @throws TreeValidationException if a field value is invalid; the node is
     *                                 then left unchanged.
     */
    public boolean update(String id, NodeUpdate fields) {
        EventNode node = find(id);
        if (node == null)
            return false;
        fields.applyTo(node);
        return true;
    }

    /**
     * Proposes an id for a new child: {@code {parentId}_{k}} with k one past
     * the largest numeric suffix among the parent's children using that
     * prefix. Skips over any id already taken elsewhere in the tree.
     */
    public String nextChildId(String parentId) {
        EventNode parent = find(parentId);
        String prefix = parentId + "_";
        int maxIndex = -1;
        if (parent != null) {
            for (EventNode child : parent.getChildren()) {
                String cid = child.getId();
                if (!cid.startsWith(prefix))
                    continue;
                try {
                    maxIndex = Math.max(maxIndex, Integer.parseInt(cid.substring(cid.lastIndexOf('_') + 1)));
                } catch (NumberFormatException e) {
                    log.trace("Ignoring non-numeric child id suffix: {}", cid);
                }
            }
        }
        int next = maxIndex + 1;
        while (contains(prefix + next))
            next++;
        return prefix + next;
    }

    // ── Traversal ────────────────────────────────────────────────

    /**
     * Lists every node as {@code (id, name)} in pre-order. Computed fresh on
     * each call.
     */
    public List<NodeSummary> flattenPreorder() {
        List<NodeSummary> out = new ArrayList<>();
        forEachPreorder(n -> out.add(new NodeSummary(n.getId(), n.getName())));
        return out;
    }

    public void forEachPreorder(Consumer<EventNode> visitor) {
        visit(root, visitor);
    }

    private static void visit(EventNode node, Consumer<EventNode> visitor) {
        visitor.accept(node);
        for (EventNode child : node.getChildren())
            visit(child, visitor);
    }

    public int size() {
        int[] count = { 0 };
        forEachPreorder(n -> count[0]++);
        return count[0];
    }

    private static void collectIds(EventNode node, Set<String> ids) {
        if (!ids.add(node.getId()))
            throw new TreeValidationException("Duplicate node id: '" + node.getId() + "'");
        for (EventNode child : node.getChildren())
            collectIds(child, ids);
    }

    // ── Normalization ────────────────────────────────────────────

    /** Normalizes a document's top-level node. */
    public static EventNode normalizeRoot(TreeDocument.NodeDef raw) {
        return normalize(raw, ROOT_PARENT_HINT, 0);
    }

    /**
     * Builds a validated node tree from a loosely-typed definition, top-down.
     *
     * Missing or empty ids default to {@code {parentIdHint}_{indexHint}};
     * missing names to {@code Node_{id}}; missing probability to 1.0; missing
     * type to "Event"; gates and relations are upper-cased and default to OR;
     * notes default to empty. Previously calculated values are discarded.
     *
     * @throws TreeValidationException for out-of-range probabilities or
     *                                 unknown gate/relation strings.
     */
    public static EventNode normalize(TreeDocument.NodeDef raw, String parentIdHint, int indexHint) {
        if (raw == null)
            throw new TreeValidationException("Missing node definition under '" + parentIdHint + "'");
        String id = raw.getId() == null || raw.getId().isEmpty() ? parentIdHint + "_" + indexHint : raw.getId();
        String name = raw.getName() != null ? raw.getName() : "Node_" + id;
        double probability = raw.getProbability() != null ? raw.getProbability() : 1.0;

        EventNode node = new EventNode(id, name, raw.getType(), probability,
                LogicGate.fromString(raw.getLogicGate()), raw.getNotes());

        if (raw.getLinks() != null) {
            for (TreeDocument.LinkDef l : raw.getLinks()) {
                if (l == null)
                    continue;
                node.addLink(new EventLink(l.getTargetId(), LogicGate.fromString(l.getRelation())));
            }
        }

        if (raw.getChildren() != null) {
            List<TreeDocument.NodeDef> children = raw.getChildren();
            for (int i = 0; i < children.size(); i++)
                node.addChild(normalize(children.get(i), id, i));
        }
        return node;
    }
}
