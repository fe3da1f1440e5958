package com.reliability.fta;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.EvaluationListener;
import com.reliability.fta.api.ProbabilityEvaluator;
import com.reliability.fta.engine.EtaEvaluator;
import com.reliability.fta.engine.EvaluationContext;
import com.reliability.fta.engine.FtaEvaluator;
import com.reliability.fta.engine.NodeStore;
import com.reliability.fta.io.LoadedTree;
import com.reliability.fta.io.TreeDocument;
import com.reliability.fta.io.TreeDocumentReader;
import com.reliability.fta.io.TreeDocumentWriter;
import com.reliability.fta.node.EventNode;
import com.reliability.fta.node.NodeSummary;
import com.reliability.fta.node.NodeUpdate;
import com.reliability.fta.util.CompositeEvaluationListener;
import com.reliability.fta.util.PassStatisticsListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A fault tree or event tree analysis: the tree, its mode and its metadata.
 * <p>
 * This class handles:
 * <ul>
 * <li>Selecting the evaluator for the current {@link AnalysisMode}</li>
 * <li>Running a full recalculation after every mode switch, insertion, update
 * and deletion</li>
 * <li>Deriving the zero-probability node set for presentation</li>
 * <li>Loading and saving documents</li>
 * </ul>
 * <p>
 * Metadata (title, date, last saved file) carries no computational weight.
 * <p>
 * Not thread-safe. Use one thread, or put a
 * {@link com.reliability.fta.wiring.TreeCommandBus} in front of it.
 */
public class FaultTreeAnalysis {
    private static final Logger log = LogManager.getLogger(FaultTreeAnalysis.class);

    public static final String DEFAULT_TITLE = "Untitled Analysis";

    private final NodeStore store;
    private final Map<AnalysisMode, ProbabilityEvaluator> evaluators = new EnumMap<>(AnalysisMode.class);
    private final CompositeEvaluationListener listeners = new CompositeEvaluationListener();
    private final TreeDocumentReader reader = new TreeDocumentReader();
    private final TreeDocumentWriter writer = new TreeDocumentWriter();
    private final Clock clock;

    private AnalysisMode mode = AnalysisMode.FTA;
    private String title = DEFAULT_TITLE;
    private String date;
    private Path lastSavedFile;

    private long pass;
    private Set<String> zeroProbabilityNodes = Collections.emptySet();

    /** Creates an analysis holding the single default root. */
    public FaultTreeAnalysis() {
        this(EventNode.defaultRoot(), AnalysisMode.FTA);
    }

    public FaultTreeAnalysis(EventNode root, AnalysisMode mode) {
        this(root, mode, Clock.systemDefaultZone());
    }

    FaultTreeAnalysis(EventNode root, AnalysisMode mode, Clock clock) {
        this.clock = clock;
        this.store = new NodeStore(root);
        this.mode = mode;
        this.date = today();
        register(new FtaEvaluator());
        register(new EtaEvaluator());
        recalculate();
    }

    private void register(ProbabilityEvaluator evaluator) {
        evaluators.put(evaluator.mode(), evaluator);
    }

    /**
     * Registers a listener for recalculation passes. Adds to the existing
     * listeners rather than replacing them.
     */
    public void addListener(EvaluationListener listener) {
        listeners.add(listener);
    }

    /** Registers and returns a statistics listener. */
    public PassStatisticsListener enablePassStatistics() {
        var stats = new PassStatisticsListener();
        listeners.add(stats);
        return stats;
    }

    // ── Recalculation ────────────────────────────────────────────

    /**
     * Recomputes every node's calculated probability with the evaluator for
     * the current mode, then the zero-probability set.
     *
     * @return Number of nodes evaluated.
     */
    public int recalculate() {
        var context = new EvaluationContext(++pass, listeners.isEmpty() ? null : listeners);
        int evaluated = evaluators.get(mode).recalculate(store, context);
        zeroProbabilityNodes = collectZeroProbabilityNodes();
        log.debug("Pass {} ({}): {} nodes, {} zero-probability", pass, mode, evaluated,
                zeroProbabilityNodes.size());
        return evaluated;
    }

    private Set<String> collectZeroProbabilityNodes() {
        Set<String> zero = new LinkedHashSet<>();
        store.forEachPreorder(n -> {
            Double calc = n.getCalculatedProbability();
            double calculated = calc != null ? calc : n.getProbability();
            if (n.getProbability() == 0.0 || calculated == 0.0)
                zero.add(n.getId());
        });
        return Collections.unmodifiableSet(zero);
    }

    /** Ids whose base or calculated probability is zero, in pre-order. */
    public Set<String> zeroProbabilityNodes() {
        return zeroProbabilityNodes;
    }

    public long passCount() {
        return pass;
    }

    // ── Structure ────────────────────────────────────────────────

    /**
     * Inserts {@code node} as the last child of {@code parentId}, then
     * recalculates.
     *
     * @return false if the parent did not resolve; the node is then discarded.
     */
    public boolean insert(String parentId, EventNode node) {
        boolean attached = store.insert(parentId, node);
        recalculate();
        return attached;
    }

    /** Merges fields into a node, then recalculates. */
    public boolean update(String nodeId, NodeUpdate fields) {
        boolean found = store.update(nodeId, fields);
        recalculate();
        return found;
    }

    /** Deletes a node and its subtree, then recalculates. */
    public boolean delete(String nodeId) {
        boolean removed = store.delete(nodeId);
        recalculate();
        return removed;
    }

    /**
     * @return The node, or null if not found.
     */
    public EventNode find(String nodeId) {
        return store.find(nodeId);
    }

    public List<NodeSummary> flattenPreorder() {
        return store.flattenPreorder();
    }

    public String nextChildId(String parentId) {
        return store.nextChildId(parentId);
    }

    public EventNode root() {
        return store.root();
    }

    public NodeStore store() {
        return store;
    }

    // ── Mode and metadata ────────────────────────────────────────

    public AnalysisMode mode() {
        return mode;
    }

    /** Switches propagation semantics and recalculates. */
    public void setMode(AnalysisMode mode) {
        this.mode = mode;
        recalculate();
    }

    public String title() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String date() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    /**
     * Sets any of the metadata fields; null arguments leave a field alone.
     * When title or mode change without an explicit date, the date moves to
     * today.
     */
    public void setMetadata(String title, String date, AnalysisMode mode) {
        if (title != null)
            this.title = title;
        if (date != null)
            this.date = date;
        else if (title != null || mode != null)
            this.date = today();
        if (mode != null)
            setMode(mode);
    }

    public Path lastSavedFile() {
        return lastSavedFile;
    }

    /** Resets to a single default root with default metadata. */
    public void newAnalysis() {
        store.replaceRoot(EventNode.defaultRoot());
        title = DEFAULT_TITLE;
        date = today();
        mode = AnalysisMode.FTA;
        lastSavedFile = null;
        recalculate();
    }

    // ── Persistence ──────────────────────────────────────────────

    /**
     * Replaces the current tree and metadata with a document's contents and
     * recalculates. Legacy documents reset metadata to defaults.
     *
     * @throws IOException if the file cannot be read or decoded as JSON.
     */
    public void load(Path path) throws IOException {
        apply(reader.read(path));
        lastSavedFile = path;
    }

    /** As {@link #load(Path)} for a document held in memory. */
    public void loadString(String json) throws IOException {
        apply(reader.parse(json));
    }

    private void apply(LoadedTree loaded) {
        store.replaceRoot(loaded.root());
        title = loaded.title() != null ? loaded.title() : DEFAULT_TITLE;
        date = loaded.date() != null ? loaded.date() : today();
        mode = loaded.mode();
        recalculate();
    }

    /** Saves to {@code path} and remembers it as the last saved file. */
    public void save(Path path) throws IOException {
        lastSavedFile = path;
        save();
    }

    /**
     * Saves to the last saved file.
     *
     * @throws IllegalStateException if no file is known yet.
     */
    public void save() throws IOException {
        if (lastSavedFile == null)
            throw new IllegalStateException("No file path specified");
        if (date == null || date.isEmpty())
            date = today();
        writer.write(toDocument(), lastSavedFile);
        log.info("Saved analysis '{}' to {}", title, lastSavedFile);
    }

    /** Deep copy of the current state in document form. */
    public TreeDocument toDocument() {
        return TreeDocumentWriter.toDocument(title, date, mode, store.root());
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }
}
