package com.zzf.clawcontrol.loop;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Deterministic {@link EventLoop} for tests. Posted tasks run right away, after the task
 * currently running; timers only fire from {@link #advance(long)}.
 */
public class ManualEventLoop implements EventLoop {
    private final Deque<Runnable> queue = new ArrayDeque<>();
    private final List<Timer> timers = new ArrayList<>();
    private long now = 1_000_000L;
    private long sequence;
    private boolean draining;

    private static final class Timer {
        final long dueAt;
        final long seq;
        final Runnable task;
        boolean cancelled;

        Timer(long dueAt, long seq, Runnable task) {
            this.dueAt = dueAt;
            this.seq = seq;
            this.task = task;
        }
    }

    @Override
    public void execute(Runnable task) {
        queue.add(task);
        drain();
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMillis) {
        Timer timer = new Timer(now + Math.max(0L, delayMillis), sequence++, task);
        timers.add(timer);
        return () -> timer.cancelled = true;
    }

    @Override
    public long currentTimeMillis() {
        return now;
    }

    /**
     * Move the clock forward, firing due timers in order.
     */
    public void advance(long millis) {
        long target = now + millis;
        while (true) {
            Timer next = timers.stream()
                    .filter(t -> !t.cancelled && t.dueAt <= target)
                    .min(Comparator.<Timer>comparingLong(t -> t.dueAt).thenComparingLong(t -> t.seq))
                    .orElse(null);
            if (next == null) {
                break;
            }
            timers.remove(next);
            now = Math.max(now, next.dueAt);
            execute(next.task);
        }
        now = target;
        timers.removeIf(t -> t.cancelled);
    }

    public int pendingTimers() {
        return (int) timers.stream().filter(t -> !t.cancelled).count();
    }

    private void drain() {
        if (draining) {
            return;
        }
        draining = true;
        try {
            Runnable task;
            while ((task = queue.poll()) != null) {
                task.run();
            }
        } finally {
            draining = false;
        }
    }
}
