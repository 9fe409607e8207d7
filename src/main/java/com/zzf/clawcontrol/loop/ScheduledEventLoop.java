package com.zzf.clawcontrol.loop;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by a single-thread scheduled executor.
 * <p>
 * {@link #close()} lets tasks already posted with {@link #execute} finish (a disconnect
 * queued during shutdown still reaches the transport) but discards delayed timers.
 */
@Slf4j
public final class ScheduledEventLoop implements EventLoop, AutoCloseable {

    static final long CLOSE_TIMEOUT_MILLIS = 2000L;

    private final ScheduledThreadPoolExecutor executor;

    public ScheduledEventLoop(String threadName) {
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        // cancelled reconnect/timeout timers leave the queue immediately
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop is shut down, dropping task");
        }
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMillis) {
        try {
            ScheduledFuture<?> future = executor.schedule(guarded(task), Math.max(0L, delayMillis), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop is shut down, dropping scheduled task");
            return () -> {
            };
        }
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    int queuedTaskCount() {
        return executor.getQueue().size();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(CLOSE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("Event loop did not drain within {} ms, interrupting", CLOSE_TIMEOUT_MILLIS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable t) {
                log.error("Event loop task failed", t);
            }
        };
    }
}
