package com.zzf.clawcontrol.sync;

import com.zzf.clawcontrol.loop.Cancellable;
import com.zzf.clawcontrol.loop.EventLoop;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collapses bursts per key: each submit cancels the key's pending task and schedules
 * the new one after the delay, so only the last submission runs.
 */
public class Debouncer {
    private final EventLoop loop;
    private final long delayMillis;
    private final Map<String, Cancellable> pending = new ConcurrentHashMap<>();

    public Debouncer(EventLoop loop, long delayMillis) {
        this.loop = loop;
        this.delayMillis = delayMillis;
    }

    public void submit(String key, Runnable task) {
        final Cancellable[] self = {null};
        self[0] = loop.schedule(() -> {
            pending.remove(key, self[0]);
            task.run();
        }, delayMillis);
        Cancellable previous = pending.put(key, self[0]);
        if (previous != null) {
            previous.cancel();
        }
    }

    public boolean isPending(String key) {
        return pending.containsKey(key);
    }

    public int pendingCount() {
        return pending.size();
    }

    public void cancelAll() {
        for (Cancellable task : pending.values()) {
            task.cancel();
        }
        pending.clear();
    }
}
