package com.phillippitts.surveyprogress.service.progress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Unbounded FIFO mailbox drained by exactly one logical worker.
 *
 * <p>Any number of threads may {@link #offer(ControllerCommand)} concurrently; offering never
 * blocks. Commands are handed to the handler one at a time, in the order they were accepted,
 * on a thread borrowed from the shared {@link Executor}. The {@code draining} flag guarantees
 * that at most one drain task exists at any moment, so the handler never runs concurrently
 * with itself and needs no locking of its own.
 *
 * <p>A drain task processes at most {@code batchSize} commands before it hands the thread back
 * to the pool and reschedules itself.
 *
 * <p>If the executor rejects a drain task, every command still queued is handed to the
 * {@code abandonHandler} instead of being left without a worker. The command whose own
 * {@link #offer(ControllerCommand)} was rejected is not abandoned; the caller sees {@code false}.
 *
 * @since 0.1
 */
final class CommandQueue {

    private static final Logger LOG = LogManager.getLogger(CommandQueue.class);

    private final Queue<ControllerCommand> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final Executor executor;
    private final Consumer<ControllerCommand> handler;
    private final Consumer<ControllerCommand> abandonHandler;
    private final int batchSize;
    private volatile boolean closed;

    /**
     * @param executor  pool lending threads to the worker
     * @param handler        applies a single command; must not throw
     * @param abandonHandler receives accepted commands that can no longer be drained; must not throw
     * @param batchSize      maximum commands per drain task (at least 1)
     */
    CommandQueue(Executor executor,
                 Consumer<ControllerCommand> handler,
                 Consumer<ControllerCommand> abandonHandler,
                 int batchSize) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.abandonHandler = Objects.requireNonNull(abandonHandler, "abandonHandler must not be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
        }
        this.batchSize = batchSize;
    }

    /**
     * Enqueues a command without blocking.
     *
     * @return {@code true} if the command was accepted, {@code false} if the queue is closed or the
     *         worker could not be scheduled
     */
    boolean offer(ControllerCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        if (closed) {
            return false;
        }
        mailbox.add(command);
        if (scheduleDrain()) {
            return true;
        }
        // A drain scheduled by another producer in the meantime may already have taken it.
        boolean stillQueued = mailbox.remove(command);
        abandonQueued();
        return !stillQueued;
    }

    /**
     * Stops accepting commands. Commands already accepted are still drained.
     */
    void close() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    int pendingCount() {
        return mailbox.size();
    }

    private boolean scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return true; // the running drain task will pick the command up
        }
        try {
            executor.execute(this::drain);
            return true;
        } catch (RejectedExecutionException e) {
            draining.set(false);
            LOG.warn("Command worker could not be scheduled: {}", e.toString());
            return false;
        }
    }

    private void drain() {
        try {
            int processed = 0;
            ControllerCommand command;
            while (processed < batchSize && (command = mailbox.poll()) != null) {
                handler.accept(command);
                processed++;
            }
        } finally {
            draining.set(false);
            if (!mailbox.isEmpty() && !scheduleDrain()) {
                abandonQueued();
            }
        }
    }

    /**
     * Hands every queued command to the abandon handler. Takes the {@code draining} flag so it never
     * races a running drain task; if the flag is held, its holder is responsible for the mailbox.
     */
    private void abandonQueued() {
        while (!mailbox.isEmpty() && draining.compareAndSet(false, true)) {
            try {
                int abandoned = 0;
                ControllerCommand command;
                while ((command = mailbox.poll()) != null) {
                    abandonHandler.accept(command);
                    abandoned++;
                }
                if (abandoned > 0) {
                    LOG.warn("Abandoned {} queued command(s) after the worker could not be scheduled", abandoned);
                }
            } finally {
                draining.set(false);
            }
        }
    }
}
