package com.phillippitts.graphicrecorder.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared delegate executor.
 *
 * <p>Each WebSocket connection gets one of these over the shared connection pool, so all
 * state a connection owns is only ever touched by one task at a time without explicit
 * locking.
 *
 * <p>At most one drain task is handed to the delegate at a time. It polls the queue in a
 * loop until the queue is empty, so a backlog never deepens the call stack, even when the
 * delegate runs the drain on the caller's thread. The monitor is only held around queue
 * access, never while a task runs.
 *
 * <p>A task that throws is logged and the drain moves on to the next task.
 */
public final class SerialExecutor implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialExecutor.class);

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor delegate;
    private boolean draining;

    public SerialExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (this) {
            tasks.add(task);
            if (draining) {
                return;
            }
            draining = true;
        }
        try {
            delegate.execute(this::drain);
        } catch (RuntimeException e) {
            synchronized (this) {
                draining = false;
            }
            throw e;
        }
    }

    private void drain() {
        boolean finished = false;
        try {
            Runnable next;
            while ((next = poll()) != null) {
                try {
                    next.run();
                } catch (RuntimeException e) {
                    LOG.error("Task failed on serial executor", e);
                }
            }
            finished = true;
        } finally {
            if (!finished) {
                // an Error escaped a task; the next submission restarts the drain
                synchronized (this) {
                    draining = false;
                }
            }
        }
    }

    private synchronized Runnable poll() {
        Runnable next = tasks.poll();
        if (next == null) {
            draining = false;
        }
        return next;
    }
}
