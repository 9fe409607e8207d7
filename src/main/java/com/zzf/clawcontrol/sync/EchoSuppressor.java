package com.zzf.clawcontrol.sync;

import com.zzf.clawcontrol.loop.EventLoop;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers paths we just wrote on the app's behalf so the watcher's notification for
 * that write is not reported back as a local edit. Entries expire after the window and
 * are pruned when looked up.
 */
public class EchoSuppressor {
    private final EventLoop clock;
    private final long windowMillis;
    private final Map<String, Long> suppressedAt = new ConcurrentHashMap<>();

    public EchoSuppressor(EventLoop clock, long windowMillis) {
        this.clock = clock;
        this.windowMillis = windowMillis;
    }

    /**
     * Must be called before the write reaches the filesystem.
     */
    public void suppress(String relPath) {
        suppressedAt.put(relPath, clock.currentTimeMillis());
    }

    public boolean isSuppressed(String relPath) {
        Long at = suppressedAt.get(relPath);
        if (at == null) {
            return false;
        }
        if (clock.currentTimeMillis() - at < windowMillis) {
            return true;
        }
        suppressedAt.remove(relPath, at);
        return false;
    }

    public int size() {
        return suppressedAt.size();
    }

    public void clear() {
        suppressedAt.clear();
    }
}
