package com.reliability.fta.wiring;

import com.reliability.fta.FaultTreeAnalysis;
import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.io.TreeDocument;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A mutable command slot in the {@link TreeCommandBus} ring buffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> instances are pre-allocated when the ring buffer
 * is built and reused for every published command. Producers fill a slot via
 * one of the {@code set*} methods; the handler reads it on the evaluation
 * thread and answers through {@link #reply()}.
 *
 * <p>
 * <b>Fields:</b>
 * <ul>
 * <li>{@code type}: what to do.</li>
 * <li>{@code nodeId}: parent id for inserts, target id otherwise.</li>
 * <li>{@code definition}: node payload for inserts and updates.</li>
 * <li>{@code mode}: new mode for mode switches.</li>
 * <li>{@code query}: read-only function for queries; must return detached
 * data.</li>
 * </ul>
 */
public final class TreeCommand {

    public enum Type {
        INSERT, UPDATE, DELETE, SET_MODE, QUERY
    }

    private Type type;
    private String nodeId;
    private TreeDocument.NodeDef definition;
    private AnalysisMode mode;
    private Function<FaultTreeAnalysis, ?> query;
    private CompletableFuture<Object> reply;

    public void setInsert(String parentId, TreeDocument.NodeDef definition) {
        this.type = Type.INSERT;
        this.nodeId = parentId;
        this.definition = definition;
    }

    public void setUpdate(String nodeId, TreeDocument.NodeDef definition) {
        this.type = Type.UPDATE;
        this.nodeId = nodeId;
        this.definition = definition;
    }

    public void setDelete(String nodeId) {
        this.type = Type.DELETE;
        this.nodeId = nodeId;
    }

    public void setMode(AnalysisMode mode) {
        this.type = Type.SET_MODE;
        this.mode = mode;
    }

    public void setQuery(Function<FaultTreeAnalysis, ?> query) {
        this.type = Type.QUERY;
        this.query = query;
    }

    void setReply(CompletableFuture<Object> reply) {
        this.reply = reply;
    }

    public Type type() {
        return type;
    }

    public String nodeId() {
        return nodeId;
    }

    public TreeDocument.NodeDef definition() {
        return definition;
    }

    public AnalysisMode mode() {
        return mode;
    }

    public Function<FaultTreeAnalysis, ?> query() {
        return query;
    }

    public CompletableFuture<Object> reply() {
        return reply;
    }

    public void clear() {
        type = null;
        nodeId = null;
        definition = null;
        mode = null;
        query = null;
        reply = null;
    }
}
