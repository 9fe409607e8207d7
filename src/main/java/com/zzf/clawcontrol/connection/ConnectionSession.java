package com.zzf.clawcontrol.connection;

import com.zzf.clawcontrol.loop.Cancellable;
import com.zzf.clawcontrol.loop.EventLoop;
import com.zzf.clawcontrol.protocol.ConnectedFrame;
import com.zzf.clawcontrol.protocol.ConversationFrame;
import com.zzf.clawcontrol.protocol.FileSnapshotAckFrame;
import com.zzf.clawcontrol.protocol.FileSyncPushFrame;
import com.zzf.clawcontrol.protocol.FrameCodec;
import com.zzf.clawcontrol.protocol.FrameTypes;
import com.zzf.clawcontrol.protocol.InboundFrame;
import com.zzf.clawcontrol.protocol.OutboundFrame;
import com.zzf.clawcontrol.protocol.ProtocolException;
import com.zzf.clawcontrol.protocol.PulseFrame;
import com.zzf.clawcontrol.protocol.RequestFrame;
import com.zzf.clawcontrol.protocol.ResponseFrame;
import com.zzf.clawcontrol.protocol.ThreadInfo;
import com.zzf.clawcontrol.protocol.ThreadListFrame;
import com.zzf.clawcontrol.protocol.UserMessageFrame;
import com.zzf.clawcontrol.transport.CloseCodes;
import com.zzf.clawcontrol.transport.Transport;
import com.zzf.clawcontrol.transport.TransportFactory;
import com.zzf.clawcontrol.transport.TransportListener;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * The single outbound connection to the ClawControl app for one account.
 *
 * <p>Owns the socket, the reconnect timer and the request correlation table. Every state
 * change runs on the {@link EventLoop}; public methods may be called from any thread and
 * post their work onto the loop. Transitions are computed by {@link ConnectionStateMachine}
 * and the resulting effects are carried out here.</p>
 */
@Slf4j
public class ConnectionSession {
    private static final String THREAD_LIST_REQUEST = FrameTypes.THREAD_LIST_REQUEST;
    private static final String THREAD_INFO_REQUEST = FrameTypes.THREAD_INFO_REQUEST;

    private final String accountId;
    private final URI endpoint;
    private final FrameCodec codec;
    private final TransportFactory transportFactory;
    private final EventLoop loop;
    private final ConnectionStateMachine stateMachine;
    private final PendingRequests pendingRequests;
    private final long reconnectDelayMillis;
    private final long requestTimeoutMillis;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean retired;
    private volatile List<ThreadInfo> threads = List.of();

    private volatile InboundMessageHandler messageHandler;
    private volatile Consumer<List<ThreadInfo>> threadListHandler;
    private volatile FileSyncHandler fileSyncHandler;
    private volatile Runnable connectedHandler;

    // loop-confined
    private Transport transport;
    private long attempt;
    private Cancellable reconnectTask;
    private int consecutiveAuthRejections;

    public ConnectionSession(ConnectionSettings settings, FrameCodec codec, TransportFactory transportFactory, EventLoop loop) {
        this.accountId = settings.getAccountId();
        this.endpoint = Endpoints.resolveWebSocketEndpoint(settings.getUrl(), settings.getToken());
        this.codec = codec;
        this.transportFactory = transportFactory;
        this.loop = loop;
        this.stateMachine = new ConnectionStateMachine(settings.getMaxAuthRejections());
        this.pendingRequests = new PendingRequests(loop);
        this.reconnectDelayMillis = settings.getReconnectDelayMillis();
        this.requestTimeoutMillis = settings.getRequestTimeoutMillis();
    }

    public String getAccountId() {
        return accountId;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * True once the app closed this connection as superseded (or authentication kept
     * failing). A retired session never reconnects.
     */
    public boolean isRetired() {
        return retired;
    }

    public PendingRequests getPendingRequests() {
        return pendingRequests;
    }

    public void setMessageHandler(InboundMessageHandler handler) {
        this.messageHandler = handler;
    }

    public void setThreadListHandler(Consumer<List<ThreadInfo>> handler) {
        this.threadListHandler = handler;
    }

    public void setFileSyncHandler(FileSyncHandler handler) {
        this.fileSyncHandler = handler;
    }

    /**
     * Runs on the loop after every successful open, once the handshake frame went out.
     */
    public void setConnectedHandler(Runnable handler) {
        this.connectedHandler = handler;
    }

    // ── lifecycle ──

    public void connect() {
        loop.execute(() -> {
            if (retired) {
                log.warn("[{}] Session was superseded, ignoring connect", accountId);
                return;
            }
            apply(ConnectionEvent.connectRequested());
        });
    }

    public void disconnect() {
        loop.execute(() -> apply(ConnectionEvent.disconnectRequested()));
    }

    private void apply(ConnectionEvent event) {
        ConnectionState before = state;
        Transition transition = stateMachine.next(before, event);
        state = transition.getNext();
        if (before != transition.getNext() || !transition.getEffects().isEmpty()) {
            log.debug("[{}] {} --{}--> {} {}", accountId, before, event.getKind(), transition.getNext(), transition.getEffects());
        }
        for (Effect effect : transition.getEffects()) {
            perform(effect, event);
        }
    }

    private void perform(Effect effect, ConnectionEvent cause) {
        switch (effect) {
            case OPEN_TRANSPORT:
                openTransport();
                break;
            case SEND_HANDSHAKE:
                log.info("[{}] WebSocket connected", accountId);
                consecutiveAuthRejections = 0;
                transmit(new ConnectedFrame());
                notifyConnected();
                break;
            case CLOSE_TRANSPORT:
                closeTransport();
                break;
            case SCHEDULE_RECONNECT:
                transport = null;
                log.info("[{}] WebSocket disconnected (code: {}, reason: {}), reconnecting in {}ms",
                        accountId, cause.getCloseCode(), cause.getReason(), reconnectDelayMillis);
                cancelReconnect();
                reconnectTask = loop.schedule(this::onReconnectDue, reconnectDelayMillis);
                break;
            case CANCEL_RECONNECT:
                cancelReconnect();
                break;
            case RETIRE:
                transport = null;
                retired = true;
                cancelReconnect();
                if (cause.getKind() == ConnectionEvent.Kind.AUTH_REJECTED) {
                    log.error("[{}] Authentication rejected {} times in a row, giving up; check the token",
                            accountId, cause.getConsecutiveAuthRejections());
                } else {
                    log.info("[{}] WebSocket closed (replaced by newer connection), not reconnecting", accountId);
                }
                break;
            default:
                break;
        }
    }

    private void openTransport() {
        long current = ++attempt;
        log.info("[{}] Connecting to {}", accountId, Endpoints.redact(endpoint));
        try {
            transport = transportFactory.open(endpoint, new AttemptListener(current));
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to open WebSocket: {}", accountId, e.toString());
            transport = null;
            apply(ConnectionEvent.closed(CloseCodes.ABNORMAL, e.getMessage()));
        }
    }

    private void closeTransport() {
        // callbacks still in flight from the closed socket must not touch the new state
        attempt++;
        Transport current = transport;
        transport = null;
        if (current != null) {
            try {
                current.close(CloseCodes.NORMAL, "client disconnect");
            } catch (RuntimeException e) {
                log.warn("[{}] Error while closing WebSocket: {}", accountId, e.toString());
            }
        }
    }

    private void cancelReconnect() {
        Cancellable task = reconnectTask;
        reconnectTask = null;
        if (task != null) {
            task.cancel();
        }
    }

    private void onReconnectDue() {
        reconnectTask = null;
        if (retired) {
            return;
        }
        apply(ConnectionEvent.reconnectDue());
    }

    private void notifyConnected() {
        Runnable handler = connectedHandler;
        if (handler == null) {
            return;
        }
        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("[{}] Connected handler failed", accountId, e);
        }
    }

    private final class AttemptListener implements TransportListener {
        private final long id;

        private AttemptListener(long id) {
            this.id = id;
        }

        @Override
        public void onOpen() {
            loop.execute(() -> {
                if (isCurrent()) {
                    apply(ConnectionEvent.opened());
                }
            });
        }

        @Override
        public void onText(String text) {
            loop.execute(() -> {
                if (isCurrent()) {
                    handleInbound(text);
                }
            });
        }

        @Override
        public void onClose(int code, String reason) {
            loop.execute(() -> {
                if (!isCurrent()) {
                    return;
                }
                transport = null;
                if (code == CloseCodes.AUTH_REJECTED) {
                    consecutiveAuthRejections++;
                    log.warn("[{}] WebSocket handshake rejected ({}), attempt {} of {}",
                            accountId, reason, consecutiveAuthRejections, stateMachine.getMaxAuthRejections());
                    apply(ConnectionEvent.authRejected(consecutiveAuthRejections, reason));
                } else {
                    apply(ConnectionEvent.closed(code, reason));
                }
            });
        }

        @Override
        public void onError(Throwable error) {
            loop.execute(() -> {
                if (!isCurrent()) {
                    return;
                }
                log.error("[{}] WebSocket error: {}", accountId, error.getMessage());
                apply(ConnectionEvent.transportError(error.getMessage()));
            });
        }

        private boolean isCurrent() {
            if (id != attempt) {
                log.debug("[{}] Ignoring callback from stale connection attempt {}", accountId, id);
                return false;
            }
            return true;
        }
    }

    // ── inbound ──

    private void handleInbound(String text) {
        InboundFrame frame;
        try {
            frame = codec.decode(text);
        } catch (ProtocolException e) {
            log.warn("[{}] Dropping inbound frame: {}", accountId, e.getMessage());
            return;
        }

        if (frame instanceof ResponseFrame response) {
            if (!pendingRequests.complete(response)) {
                log.debug("[{}] Dropping response for unknown request {}", accountId, response.getRequestId());
            }
        } else if (frame instanceof ThreadListFrame threadList) {
            List<ThreadInfo> fresh = threadList.getThreads() == null ? List.of() : List.copyOf(threadList.getThreads());
            threads = fresh;
            log.info("[{}] received thread_list: {} threads", accountId, fresh.size());
            Consumer<List<ThreadInfo>> handler = threadListHandler;
            if (handler != null) {
                invoke("Thread list handler", () -> handler.accept(fresh));
            }
        } else if (frame instanceof UserMessageFrame message) {
            InboundMessageHandler handler = messageHandler;
            if (!message.hasContent()) {
                log.debug("[{}] Ignoring user_message {} without content", accountId, message.getId());
            } else if (handler != null) {
                invoke("Message handler", () -> handler.onUserMessage(message));
            }
        } else if (frame instanceof FileSyncPushFrame push) {
            FileSyncHandler handler = fileSyncHandler;
            if (handler == null) {
                log.debug("[{}] No file sync handler, dropping push for {}", accountId, push.getPath());
                return;
            }
            try {
                handler.handleServerPush(push);
            } catch (Exception e) {
                log.error("[{}] Failed to apply {} for {}", accountId, push.getAction(), push.getPath(), e);
            }
        } else if (frame instanceof FileSnapshotAckFrame ack) {
            FileSyncHandler handler = fileSyncHandler;
            if (handler == null) {
                log.debug("[{}] No file sync handler, dropping snapshot ack", accountId);
                return;
            }
            try {
                handler.handleSnapshotAck(ack);
            } catch (Exception e) {
                log.error("[{}] Failed to apply snapshot ack", accountId, e);
            }
        } else {
            log.warn("[{}] Unhandled inbound frame type {}", accountId, frame.getType());
        }
    }

    private void invoke(String what, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("[{}] {} failed", accountId, what, e);
        }
    }

    // ── outbound ──

    /**
     * Send a frame if connected; otherwise log and drop it. Never throws.
     */
    public void send(OutboundFrame frame) {
        loop.execute(() -> transmit(frame));
    }

    private boolean transmit(OutboundFrame frame) {
        Transport current = transport;
        if (state != ConnectionState.CONNECTED || current == null) {
            log.warn("[{}] Cannot send {} frame, not connected", accountId, frame == null ? "null" : frame.getType());
            return false;
        }
        try {
            current.sendText(codec.encode(frame));
            return true;
        } catch (ProtocolException e) {
            log.error("[{}] {}", accountId, e.getMessage(), e);
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to send {} frame: {}", accountId, frame.getType(), e.toString());
        }
        return false;
    }

    public void sendText(String content, String id, String threadId) {
        send(ConversationFrame.text(content, id, threadId));
    }

    public void sendTyping(String id, String threadId) {
        send(ConversationFrame.typing(id, threadId));
    }

    public void sendDone(String id, String threadId) {
        send(ConversationFrame.done(id, threadId));
    }

    public void sendError(String error, String id, String threadId) {
        send(ConversationFrame.error(error, id, threadId));
    }

    public void sendPulse(String content) {
        send(new PulseFrame(content));
    }

    public CompletableFuture<ResponseFrame> sendRequest(String kind, Map<String, ?> params) {
        return sendRequest(kind, params, requestTimeoutMillis);
    }

    /**
     * Send {@code {type: kind, requestId, ...params}} and complete with the matching
     * {@code response}. Fails with {@link RequestTimeoutException} when no response arrives
     * within {@code timeoutMillis}, with {@link RemoteRequestException} when the app answers
     * {@code ok: false}, and with {@link NotConnectedException} when not connected.
     */
    public CompletableFuture<ResponseFrame> sendRequest(String kind, Map<String, ?> params, long timeoutMillis) {
        CompletableFuture<ResponseFrame> result = new CompletableFuture<>();
        loop.execute(() -> {
            if (state != ConnectionState.CONNECTED) {
                result.completeExceptionally(new NotConnectedException("Not connected"));
                return;
            }
            PendingRequests.PendingRequest pending = pendingRequests.register(kind, timeoutMillis, result);
            if (!transmit(new RequestFrame(kind, pending.getCorrelationId(), params))) {
                pendingRequests.fail(pending.getCorrelationId(), new NotConnectedException("Not connected"));
            }
        });
        return result;
    }

    /**
     * Ask the app for its current thread list. Replaces the cached list on success.
     */
    public CompletableFuture<List<ThreadInfo>> requestThreadList() {
        return sendRequest(THREAD_LIST_REQUEST, Map.of()).thenApply(response -> {
            try {
                List<ThreadInfo> fresh = List.copyOf(codec.readThreads(response.getPayload().get("threads")));
                threads = fresh;
                return fresh;
            } catch (ProtocolException e) {
                throw new CompletionException(new RemoteRequestException("Failed to get thread list", e));
            }
        });
    }

    public CompletableFuture<ThreadInfo> requestThreadInfo(String threadId) {
        if (threadId == null || threadId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("threadId is blank"));
        }
        return sendRequest(THREAD_INFO_REQUEST, Map.of("threadId", threadId)).thenApply(response -> {
            try {
                return codec.readThread(response.getPayload().get("thread"));
            } catch (ProtocolException e) {
                throw new CompletionException(new RemoteRequestException("Thread not found", e));
            }
        });
    }

    // ── thread cache ──

    public List<ThreadInfo> getThreads() {
        return threads;
    }

    public Optional<ThreadInfo> getThread(String threadId) {
        return threads.stream().filter(t -> threadId != null && threadId.equals(t.getId())).findFirst();
    }

    public Optional<ThreadInfo> getThreadByPath(String relativePath) {
        return threads.stream().filter(t -> relativePath != null && relativePath.equals(t.getPath())).findFirst();
    }
}
