package com.reliability.fta.wiring;

import com.lmax.disruptor.EventHandler;
import com.reliability.fta.FaultTreeAnalysis;
import com.reliability.fta.io.TreeDocument;
import com.reliability.fta.io.TreeDocumentReader;
import com.reliability.fta.io.TreeDocumentWriter;
import com.reliability.fta.node.EventNode;

import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that applies {@link TreeCommand}s to the analysis.
 *
 * <p>
 * Runs on the single consumer thread, which therefore owns the
 * {@link FaultTreeAnalysis} exclusively: every mutation and its full
 * recalculation complete before the next command is read. Results handed back
 * to producers are detached copies, never live nodes.
 *
 * <p>
 * Failures (validation errors included) complete the command's reply
 * exceptionally and leave the ring buffer running.
 */
public final class TreeCommandHandler implements EventHandler<TreeCommand> {
    private static final Logger log = LogManager.getLogger(TreeCommandHandler.class);

    private final FaultTreeAnalysis analysis;

    public TreeCommandHandler(FaultTreeAnalysis analysis) {
        this.analysis = analysis;
    }

    @Override
    public void onEvent(TreeCommand command, long sequence, boolean endOfBatch) {
        CompletableFuture<Object> reply = command.reply();
        try {
            Object result = apply(command);
            if (reply != null)
                reply.complete(result);
        } catch (RuntimeException e) {
            log.debug("Command {} #{} rejected: {}", command.type(), sequence, e.getMessage());
            if (reply != null)
                reply.completeExceptionally(e);
            else
                throw e;
        } finally {
            command.clear();
        }
    }

    private Object apply(TreeCommand command) {
        return switch (command.type()) {
            case INSERT -> insert(command.nodeId(), command.definition());
            case UPDATE -> update(command.nodeId(), command.definition());
            case DELETE -> analysis.delete(command.nodeId());
            case SET_MODE -> {
                analysis.setMode(command.mode());
                yield command.mode();
            }
            case QUERY -> command.query().apply(analysis);
        };
    }

    /** @return the inserted node as a definition, or null if the parent was unknown. */
    private TreeDocument.NodeDef insert(String parentId, TreeDocument.NodeDef definition) {
        if (definition.getId() == null || definition.getId().isEmpty())
            definition.setId(analysis.nextChildId(parentId));
        EventNode node = TreeDocumentReader.toNode(definition, parentId, 0);
        if (!analysis.insert(parentId, node))
            return null;
        return TreeDocumentWriter.toDefinition(node);
    }

    /** @return the updated node as a definition, or null if it was not found. */
    private TreeDocument.NodeDef update(String nodeId, TreeDocument.NodeDef definition) {
        if (!analysis.update(nodeId, TreeDocumentReader.toUpdate(definition)))
            return null;
        return TreeDocumentWriter.toDefinition(analysis.find(nodeId));
    }
}
