package com.zzf.clawcontrol.loop;

/**
 * Handle for a task scheduled on an {@link EventLoop}.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Cancel the task if it has not run yet. Calling this more than once, or after
     * the task ran, has no effect.
     */
    void cancel();
}
