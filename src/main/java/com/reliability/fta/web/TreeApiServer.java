package com.reliability.fta.web;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.TreeValidationException;
import com.reliability.fta.io.TreeDocument;
import com.reliability.fta.io.TreeDocumentReader;
import com.reliability.fta.io.TreeDocumentWriter;
import com.reliability.fta.node.EventNode;
import com.reliability.fta.util.PassStatisticsListener;
import com.reliability.fta.util.TreeExplain;
import com.reliability.fta.wiring.TreeCommandBus;

import io.javalin.Javalin;
import io.javalin.http.Context;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP host for an analysis.
 *
 * Every request goes through the {@link TreeCommandBus}, so HTTP worker
 * threads never touch the live tree. Responses are JSON except for the
 * diagram, which is Mermaid text.
 */
public class TreeApiServer {
    private static final Logger log = LogManager.getLogger(TreeApiServer.class);

    private final TreeCommandBus bus;
    private final PassStatisticsListener statistics;
    private final TreeDocumentReader reader = new TreeDocumentReader();
    private final long requestTimeoutMs;
    private Javalin app;

    /**
     * @param statistics Listener already registered on the analysis, or null
     *                   to disable {@code /api/stats}.
     */
    public TreeApiServer(TreeCommandBus bus, PassStatisticsListener statistics, long requestTimeoutMs) {
        this.bus = bus;
        this.statistics = statistics;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    /**
     * Starts the server.
     *
     * @param port The port to listen on, 0 for any free port.
     */
    public void start(int port) {
        log.info("Starting tree API server on port {}", port);
        app = Javalin.create(config -> config.showJavalinBanner = false);

        app.exception(TreeValidationException.class, (e, ctx) -> error(ctx, 400, e.getMessage()));
        app.exception(IOException.class, (e, ctx) -> error(ctx, 400, "Malformed request body: " + e.getMessage()));
        app.exception(TimeoutException.class, (e, ctx) -> error(ctx, 503, "Timed out waiting for the evaluation thread"));

        // ── Reads ────────────────────────────────────────────────
        app.get("/api/document", ctx -> ctx.json(await(bus.query(a -> a.toDocument()))));
        app.get("/api/nodes", ctx -> ctx.json(await(bus.query(a -> a.flattenPreorder()))));
        app.get("/api/nodes/{id}", this::getNode);
        app.get("/api/zero-nodes", ctx -> ctx.json(await(bus.query(a -> new ArrayList<>(a.zeroProbabilityNodes())))));
        app.get("/api/diagram", ctx -> {
            boolean hideZero = Boolean.parseBoolean(ctx.queryParam("hideZero"));
            String diagram = await(bus.query(a -> new TreeExplain(a.store()).toMermaid(hideZero)));
            ctx.contentType("text/plain");
            ctx.result(diagram);
        });
        app.get("/api/stats", ctx -> {
            if (statistics == null) {
                error(ctx, 404, "Pass statistics not enabled");
                return;
            }
            ctx.json(await(bus.query(a -> statistics.snapshot())));
        });

        // ── Mutations ────────────────────────────────────────────
        app.post("/api/nodes/{parentId}", this::insertNode);
        app.patch("/api/nodes/{id}", this::updateNode);
        app.delete("/api/nodes/{id}", ctx -> {
            await(bus.delete(ctx.pathParam("id")));
            ctx.status(204);
        });
        app.put("/api/mode/{mode}", ctx -> {
            AnalysisMode mode = AnalysisMode.fromString(ctx.pathParam("mode"));
            ctx.json(Map.of("mode", await(bus.setMode(mode))));
        });

        app.start(port);
    }

    private void getNode(Context ctx) throws Exception {
        String id = ctx.pathParam("id");
        TreeDocument.NodeDef node = await(bus.query(a -> {
            EventNode n = a.find(id);
            return n != null ? TreeDocumentWriter.toDefinition(n) : null;
        }));
        if (node == null)
            error(ctx, 404, "Node not found: " + id);
        else
            ctx.json(node);
    }

    private void insertNode(Context ctx) throws Exception {
        String parentId = ctx.pathParam("parentId");
        TreeDocument.NodeDef inserted = await(bus.insert(parentId, body(ctx)));
        if (inserted == null)
            ctx.status(202).json(Map.of("applied", false, "parentId", parentId));
        else
            ctx.status(201).json(inserted);
    }

    private void updateNode(Context ctx) throws Exception {
        String id = ctx.pathParam("id");
        TreeDocument.NodeDef updated = await(bus.update(id, body(ctx)));
        if (updated == null)
            error(ctx, 404, "Node not found: " + id);
        else
            ctx.json(updated);
    }

    private TreeDocument.NodeDef body(Context ctx) throws IOException {
        TreeDocument.NodeDef definition = reader.parseNode(ctx.body());
        if (definition == null)
            throw new TreeValidationException("Request body must be a node object");
        return definition;
    }

    private <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.get(requestTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause)
                throw cause;
            throw e;
        }
    }

    private static void error(Context ctx, int status, String message) {
        ctx.status(status).json(Map.of("error", message));
    }

    /** Actual bound port; useful after {@code start(0)}. */
    public int port() {
        return app.port();
    }

    /**
     * Stops the server. The command bus is left running.
     */
    public void stop() {
        if (app != null) {
            app.stop();
            log.info("Tree API server stopped");
        }
    }
}
