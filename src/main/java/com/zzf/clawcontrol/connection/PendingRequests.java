package com.zzf.clawcontrol.connection;

import com.zzf.clawcontrol.loop.Cancellable;
import com.zzf.clawcontrol.loop.EventLoop;
import com.zzf.clawcontrol.protocol.ResponseFrame;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Correlation table for request/response exchanges multiplexed on one socket.
 *
 * <p>Entries leave the table when a response with their id arrives or when their own
 * deadline fires, whichever comes first. Losing the connection does not fail them.</p>
 */
@Slf4j
public class PendingRequests {
    private final EventLoop loop;
    private final AtomicLong counter = new AtomicLong();
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();

    public PendingRequests(EventLoop loop) {
        this.loop = loop;
    }

    @Getter
    public static final class PendingRequest {
        private final String correlationId;
        private final String kind;
        private final long createdAt;
        private final long deadline;
        private final CompletableFuture<ResponseFrame> result;
        private volatile Cancellable timeout;

        PendingRequest(String correlationId, String kind, long createdAt, long deadline, CompletableFuture<ResponseFrame> result) {
            this.correlationId = correlationId;
            this.kind = kind;
            this.createdAt = createdAt;
            this.deadline = deadline;
            this.result = result;
        }
    }

    public PendingRequest register(String kind, long timeoutMillis, CompletableFuture<ResponseFrame> result) {
        long now = loop.currentTimeMillis();
        String id = "req-" + now + "-" + counter.incrementAndGet();
        PendingRequest request = new PendingRequest(id, kind, now, now + timeoutMillis, result);
        pending.put(id, request);
        request.timeout = loop.schedule(() -> expire(id, timeoutMillis), timeoutMillis);
        return request;
    }

    /**
     * Settle the request a response belongs to.
     *
     * @return false when no request with that id is pending (unknown or already timed out)
     */
    public boolean complete(ResponseFrame response) {
        PendingRequest request = pending.remove(response.getRequestId());
        if (request == null) {
            return false;
        }
        cancelTimeout(request);
        if (response.isOk()) {
            request.result.complete(response);
        } else {
            String error = response.getError();
            request.result.completeExceptionally(new RemoteRequestException(
                    error == null || error.isBlank() ? "Request " + request.kind + " failed" : error));
        }
        return true;
    }

    public void fail(String correlationId, Throwable error) {
        PendingRequest request = pending.remove(correlationId);
        if (request != null) {
            cancelTimeout(request);
            request.result.completeExceptionally(error);
        }
    }

    public Optional<PendingRequest> get(String correlationId) {
        return Optional.ofNullable(pending.get(correlationId));
    }

    public boolean contains(String correlationId) {
        return pending.containsKey(correlationId);
    }

    public int size() {
        return pending.size();
    }

    private void expire(String correlationId, long timeoutMillis) {
        PendingRequest request = pending.remove(correlationId);
        if (request == null) {
            return;
        }
        log.warn("Request {} ({}) timed out after {}ms", request.kind, correlationId, timeoutMillis);
        request.result.completeExceptionally(new RequestTimeoutException(request.kind, correlationId, timeoutMillis));
    }

    private static void cancelTimeout(PendingRequest request) {
        Cancellable timeout = request.timeout;
        if (timeout != null) {
            timeout.cancel();
        }
    }
}
