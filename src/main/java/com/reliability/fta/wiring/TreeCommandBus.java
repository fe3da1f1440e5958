package com.reliability.fta.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.reliability.fta.FaultTreeAnalysis;
import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.io.TreeDocument;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

import lombok.extern.log4j.Log4j2;

/**
 * Serializes access to a {@link FaultTreeAnalysis} from any number of threads.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>A producer (for example an HTTP worker) claims a slot and fills a
 * {@link TreeCommand}.</li>
 * <li>The Disruptor sequences commands from all producers.</li>
 * <li>{@link TreeCommandHandler} applies each one on the single consumer
 * thread, recalculating after every mutation.</li>
 * <li>The producer waits on the returned future.</li>
 * </ol>
 *
 * Reads go through the same queue, so a query never observes a half-finished
 * pass.
 */
@Log4j2
public final class TreeCommandBus implements AutoCloseable {
    private final Disruptor<TreeCommand> disruptor;
    private final RingBuffer<TreeCommand> ringBuffer;

    /**
     * @param bufferSize Ring size, must be a power of two.
     */
    public TreeCommandBus(FaultTreeAnalysis analysis, int bufferSize) {
        this.disruptor = new Disruptor<>(
                TreeCommand::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new TreeCommandHandler(analysis));
        this.ringBuffer = disruptor.start();
        log.info("Tree command bus started (buffer size {})", bufferSize);
    }

    /** Inserts a node; completes with its definition, or null if the parent is unknown. */
    public CompletableFuture<TreeDocument.NodeDef> insert(String parentId, TreeDocument.NodeDef definition) {
        return cast(publish(c -> c.setInsert(parentId, definition)));
    }

    /** Merges fields; completes with the node's new definition, or null if not found. */
    public CompletableFuture<TreeDocument.NodeDef> update(String nodeId, TreeDocument.NodeDef definition) {
        return cast(publish(c -> c.setUpdate(nodeId, definition)));
    }

    /** Deletes; completes with whether anything was removed. */
    public CompletableFuture<Boolean> delete(String nodeId) {
        return cast(publish(c -> c.setDelete(nodeId)));
    }

    public CompletableFuture<AnalysisMode> setMode(AnalysisMode mode) {
        return cast(publish(c -> c.setMode(mode)));
    }

    /**
     * Runs a read-only function on the evaluation thread. The function must
     * return data detached from the live tree.
     */
    public <T> CompletableFuture<T> query(Function<FaultTreeAnalysis, T> query) {
        return cast(publish(c -> c.setQuery(query)));
    }

    private CompletableFuture<Object> publish(Consumer<TreeCommand> setup) {
        CompletableFuture<Object> reply = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            TreeCommand command = ringBuffer.get(sequence);
            command.clear();
            setup.accept(command);
            command.setReply(reply);
        } finally {
            ringBuffer.publish(sequence);
        }
        return reply;
    }

    @SuppressWarnings("unchecked")
    private static <T> CompletableFuture<T> cast(CompletableFuture<Object> future) {
        return future.thenApply(o -> (T) o);
    }

    /** Drains pending commands, then stops the consumer thread. */
    @Override
    public void close() {
        try {
            disruptor.shutdown(5, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Command bus did not drain in time, halting", e);
            disruptor.halt();
        }
        log.info("Tree command bus stopped");
    }
}
