package com.phillippitts.graphicrecorder.service.persistence;

import com.phillippitts.graphicrecorder.service.metrics.RecordingMetrics;
import com.phillippitts.graphicrecorder.util.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs persistence writes off the connection tasks, one at a time in submission order.
 *
 * <p>Writes are best-effort: a failure is logged and counted, and the returned future
 * completes with {@link Optional#empty()} rather than exceptionally, so nothing waiting on
 * it (live delivery to viewers in particular) is ever blocked or rolled back.
 */
@Component
public class PersistenceWriter {

    private static final Logger LOG = LogManager.getLogger(PersistenceWriter.class);

    private final Executor writes;
    private final RecordingMetrics metrics;

    public PersistenceWriter(@Qualifier("persistenceExecutor") Executor persistenceExecutor,
                             RecordingMetrics metrics) {
        this.writes = new SerialExecutor(persistenceExecutor);
        this.metrics = metrics;
    }

    /**
     * Queues {@code write}; {@code operation} names it in logs and metrics.
     */
    public <T> CompletableFuture<Optional<T>> submit(String operation, Supplier<T> write) {
        return CompletableFuture.supplyAsync(write, writes)
                .handle((result, error) -> {
                    if (error != null) {
                        LOG.warn("Persistence write failed (operation={}): {}", operation, rootMessage(error));
                        metrics.incrementPersistenceFailure(operation);
                        return Optional.<T>empty();
                    }
                    return Optional.ofNullable(result);
                });
    }

    /**
     * Queues a write without a result; completes with true when it succeeded.
     */
    public CompletableFuture<Boolean> run(String operation, Runnable write) {
        return submit(operation, () -> {
            write.run();
            return Boolean.TRUE;
        }).thenApply(done -> done.orElse(Boolean.FALSE));
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        return cause.getMessage();
    }
}
