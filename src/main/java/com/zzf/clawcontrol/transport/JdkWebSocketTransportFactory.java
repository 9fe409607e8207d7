package com.zzf.clawcontrol.transport;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TransportFactory} on top of the JDK {@link HttpClient} WebSocket client.
 */
@Slf4j
public class JdkWebSocketTransportFactory implements TransportFactory {
    private final HttpClient http;
    private final Duration connectTimeout;

    public JdkWebSocketTransportFactory(HttpClient http, Duration connectTimeout) {
        this.http = http;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public Transport open(URI endpoint, TransportListener listener) {
        JdkWebSocketTransport transport = new JdkWebSocketTransport(listener);
        try {
            http.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(endpoint, transport)
                    .whenComplete((socket, error) -> {
                        if (error != null) {
                            transport.openFailed(error);
                        }
                    });
        } catch (RuntimeException e) {
            transport.openFailed(e);
        }
        return transport;
    }

    static final class JdkWebSocketTransport implements Transport, WebSocket.Listener {
        private final TransportListener listener;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final StringBuilder partial = new StringBuilder();
        private volatile WebSocket socket;
        private volatile boolean closeRequested;
        private CompletableFuture<?> sendChain = CompletableFuture.completedFuture(null);

        JdkWebSocketTransport(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public synchronized void sendText(String text) {
            WebSocket current = socket;
            if (current == null || closed.get() || current.isOutputClosed()) {
                log.warn("Dropping outbound text, socket is not open");
                return;
            }
            // the JDK client rejects a send while the previous one is still in flight
            sendChain = sendChain
                    .handle((ignored, error) -> null)
                    .thenCompose(ignored -> current.sendText(text, true))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.warn("WebSocket send failed: {}", rootMessage(error));
                        }
                    });
        }

        @Override
        public void close(int code, String reason) {
            closeRequested = true;
            WebSocket current = socket;
            if (current == null) {
                return;
            }
            current.sendClose(code, reason == null ? "" : reason).whenComplete((ignored, error) -> {
                if (error != null) {
                    current.abort();
                }
            });
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            socket = webSocket;
            webSocket.request(1);
            if (closeRequested) {
                webSocket.sendClose(CloseCodes.NORMAL, "closed before open");
                return;
            }
            listener.onOpen();
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String message = partial.toString();
                partial.setLength(0);
                listener.onText(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            log.debug("Ignoring binary WebSocket message ({} bytes)", data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            fireClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
            fireClose(CloseCodes.ABNORMAL, rootMessage(error));
        }

        void openFailed(Throwable error) {
            Throwable cause = unwrap(error);
            listener.onError(cause);
            if (cause instanceof WebSocketHandshakeException handshake && handshake.getResponse() != null) {
                int status = handshake.getResponse().statusCode();
                if (status == 401 || status == 403) {
                    fireClose(CloseCodes.AUTH_REJECTED, "HTTP " + status);
                    return;
                }
                fireClose(CloseCodes.ABNORMAL, "HTTP " + status);
                return;
            }
            fireClose(CloseCodes.ABNORMAL, rootMessage(cause));
        }

        private void fireClose(int code, String reason) {
            if (closed.compareAndSet(false, true)) {
                listener.onClose(code, reason == null ? "" : reason);
            }
        }

        private static Throwable unwrap(Throwable error) {
            Throwable current = error;
            while ((current instanceof CompletionException || current instanceof ExecutionException)
                    && current.getCause() != null) {
                current = current.getCause();
            }
            return current;
        }

        private static String rootMessage(Throwable error) {
            Throwable cause = unwrap(error);
            String message = cause.getMessage();
            return message == null ? cause.getClass().getSimpleName() : message;
        }
    }
}
