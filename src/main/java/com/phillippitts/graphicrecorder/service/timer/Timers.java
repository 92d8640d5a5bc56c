package com.phillippitts.graphicrecorder.service.timer;

import java.time.Duration;

/**
 * Schedules callbacks and hands back explicit cancellation handles.
 *
 * <p>Owners (connection lifecycle, session orchestration) keep every handle they create
 * and cancel it on the transition that supersedes it. Callbacks run on the scheduler's
 * thread; owners re-post them onto their own serial executor before touching state.
 */
public interface Timers {

    TimerHandle schedule(Duration delay, Runnable task);

    TimerHandle scheduleAtFixedRate(Duration period, Runnable task);
}
