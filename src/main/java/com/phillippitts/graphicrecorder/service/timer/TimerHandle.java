package com.phillippitts.graphicrecorder.service.timer;

/**
 * Cancellable reference to a scheduled callback. Cancelling twice, or after the
 * callback ran, is harmless.
 */
@FunctionalInterface
public interface TimerHandle {

    /** Handle for "nothing scheduled". */
    TimerHandle NONE = () -> { };

    void cancel();
}
