package com.phillippitts.graphicrecorder.service.timer;

import com.phillippitts.graphicrecorder.config.logging.ConnectionMdc;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link Timers} backed by Spring's {@link TaskScheduler}. Callbacks run with the log
 * context of the thread that scheduled them.
 *
 * <p>Qualified because the WebSocket support registers a second scheduler for SockJS.
 */
@Component
public class TaskSchedulerTimers implements Timers {

    private final TaskScheduler scheduler;

    public TaskSchedulerTimers(@Qualifier("taskScheduler") TaskScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public TimerHandle schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> future = scheduler.schedule(ConnectionMdc.propagating(task), Instant.now().plus(delay));
        return () -> future.cancel(false);
    }

    @Override
    public TimerHandle scheduleAtFixedRate(Duration period, Runnable task) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(ConnectionMdc.propagating(task),
                Instant.now().plus(period), period);
        return () -> future.cancel(false);
    }
}
