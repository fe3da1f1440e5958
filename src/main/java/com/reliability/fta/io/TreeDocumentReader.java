package com.reliability.fta.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.LogicGate;
import com.reliability.fta.engine.NodeStore;
import com.reliability.fta.node.EventLink;
import com.reliability.fta.node.EventNode;
import com.reliability.fta.node.NodeUpdate;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Reads analysis documents and normalizes them into validated node trees.
 *
 * <p>
 * Accepted shapes:
 * <ul>
 * <li>{@code {title, date, mode, tree: {...}}}</li>
 * <li>legacy {@code {"FTA": {...}}}</li>
 * <li>legacy bare tree {@code {id, name, children, ...}}</li>
 * </ul>
 *
 * <p>
 * Files are decoded with the first charset that decodes cleanly (UTF-8,
 * windows-31j, Shift_JIS, windows-1252). A leading byte order mark is dropped
 * and a document wrapped in a doubled outer brace is repaired.
 *
 * <p>
 * Malformed JSON and probabilities that do not coerce to a number surface as
 * {@link IOException}; out-of-range values and unknown gates surface as
 * {@link com.reliability.fta.api.TreeValidationException}.
 */
@Log4j2
public final class TreeDocumentReader {
    static final String TREE_KEY = "tree";
    static final String LEGACY_KEY = "FTA";

    private static final List<Charset> CHARSETS = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-31j"),
            Charset.forName("Shift_JIS"),
            Charset.forName("windows-1252"));

    private final ObjectMapper mapper;

    public TreeDocumentReader() {
        this(new ObjectMapper());
    }

    public TreeDocumentReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Reads and normalizes a document file. */
    public LoadedTree read(Path path) throws IOException {
        String content = decode(Files.readAllBytes(path));
        LoadedTree loaded = parse(content);
        log.info("Loaded {} ({} format)", path, loaded.legacy() ? "legacy" : "document");
        return loaded;
    }

    /** Parses and normalizes a document held in memory. */
    public LoadedTree parse(String json) throws IOException {
        JsonNode root = mapper.readTree(repair(json));
        if (root == null || !root.isObject())
            throw new IOException("JSON root must be an object");

        if (root.has(TREE_KEY)) {
            TreeDocument doc = mapper.treeToValue(root, TreeDocument.class);
            TreeDocument.NodeDef tree = doc.getTree() != null ? doc.getTree() : new TreeDocument.NodeDef();
            return new LoadedTree(doc.getTitle(), doc.getDate(), AnalysisMode.fromString(doc.getMode()),
                    NodeStore.normalizeRoot(tree), false);
        }

        JsonNode treeNode = root.has(LEGACY_KEY) ? root.get(LEGACY_KEY) : root;
        TreeDocument.NodeDef tree = treeNode.isObject()
                ? mapper.treeToValue(treeNode, TreeDocument.NodeDef.class)
                : new TreeDocument.NodeDef();
        return new LoadedTree(null, null, AnalysisMode.FTA, NodeStore.normalizeRoot(tree), true);
    }

    /** Binds a single node definition, e.g. a request body. */
    public TreeDocument.NodeDef parseNode(String json) throws IOException {
        return mapper.readValue(json, TreeDocument.NodeDef.class);
    }

    /**
     * Converts a partial node definition into a field-merge patch. Absent
     * fields stay untouched; id, children and calculated values are ignored.
     */
    public static NodeUpdate toUpdate(TreeDocument.NodeDef def) {
        NodeUpdate update = new NodeUpdate();
        update.setName(def.getName());
        update.setType(def.getType());
        update.setProbability(def.getProbability());
        update.setNotes(def.getNotes());
        if (def.getLogicGate() != null)
            update.setLogicGate(LogicGate.fromString(def.getLogicGate()));
        if (def.getLinks() != null) {
            List<EventLink> links = new ArrayList<>(def.getLinks().size());
            for (TreeDocument.LinkDef l : def.getLinks()) {
                if (l != null)
                    links.add(new EventLink(l.getTargetId(), LogicGate.fromString(l.getRelation())));
            }
            update.setLinks(links);
        }
        return update;
    }

    /** Normalizes a node definition destined for insertion under {@code parentId}. */
    public static EventNode toNode(TreeDocument.NodeDef def, String parentId, int index) {
        return NodeStore.normalize(def, parentId, index);
    }

    static String decode(byte[] bytes) throws IOException {
        for (Charset cs : CHARSETS) {
            try {
                return cs.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException e) {
                log.debug("Document is not valid {}, trying next charset", cs.name());
            }
        }
        throw new IOException("Failed to read file with common encodings");
    }

    static String repair(String content) {
        String s = content;
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF')
            s = s.substring(1);
        s = s.strip();
        if (s.startsWith("{{")) {
            s = "{" + s.substring(2);
            if (s.endsWith("}}"))
                s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
