package com.reliability.fta.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.node.EventLink;
import com.reliability.fta.node.EventNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializes an analysis to the {@code {title, date, mode, tree}} document
 * format, including every node's calculated probability.
 *
 * The document is a deep copy: mutating the tree afterwards does not alter an
 * exported document.
 */
public final class TreeDocumentWriter {
    private final ObjectMapper mapper;

    public TreeDocumentWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public TreeDocumentWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static TreeDocument toDocument(String title, String date, AnalysisMode mode, EventNode root) {
        TreeDocument doc = new TreeDocument();
        doc.setTitle(title);
        doc.setDate(date);
        doc.setMode(mode.name());
        doc.setTree(toDefinition(root));
        return doc;
    }

    public static TreeDocument.NodeDef toDefinition(EventNode node) {
        TreeDocument.NodeDef def = new TreeDocument.NodeDef();
        def.setId(node.getId());
        def.setName(node.getName());
        def.setType(node.getType());
        def.setProbability(node.getProbability());
        def.setLogicGate(node.getLogicGate().name());
        def.setNotes(node.getNotes());
        def.setCalculatedProbability(node.getCalculatedProbability());

        List<TreeDocument.LinkDef> links = new ArrayList<>(node.getLinks().size());
        for (EventLink l : node.getLinks())
            links.add(new TreeDocument.LinkDef(l.targetId(), l.relation().name()));
        def.setLinks(links);

        List<TreeDocument.NodeDef> children = new ArrayList<>(node.getChildren().size());
        for (EventNode child : node.getChildren())
            children.add(toDefinition(child));
        def.setChildren(children);
        return def;
    }

    public String writeString(TreeDocument doc) throws JsonProcessingException {
        return mapper.writeValueAsString(doc);
    }

    public void write(TreeDocument doc, Path path) throws IOException {
        Files.writeString(path, writeString(doc), StandardCharsets.UTF_8);
    }
}
