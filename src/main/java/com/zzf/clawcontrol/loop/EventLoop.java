package com.zzf.clawcontrol.loop;

/**
 * The single cooperative loop that owns connection state, request timers,
 * debounce timers and sync evaluation.
 *
 * <p>Callers on other threads (transport callbacks, the filesystem watcher,
 * dispatcher threads) hand work to the loop through {@link #execute(Runnable)}
 * instead of touching loop-owned state directly.</p>
 */
public interface EventLoop {

    void execute(Runnable task);

    Cancellable schedule(Runnable task, long delayMillis);

    long currentTimeMillis();
}
