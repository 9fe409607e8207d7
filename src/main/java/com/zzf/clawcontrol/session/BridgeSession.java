package com.zzf.clawcontrol.session;

import com.zzf.clawcontrol.config.BridgeAccount;
import com.zzf.clawcontrol.connection.ConnectionSession;
import com.zzf.clawcontrol.loop.EventLoop;
import com.zzf.clawcontrol.protocol.UserMessageFrame;
import com.zzf.clawcontrol.sync.FileSynchronizer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Everything running for one account: the connection, the optional notes synchronizer and
 * the routing of user messages to the {@link AgentDispatcher}.
 */
@Slf4j
public class BridgeSession {
    static final String NO_DISPATCHER_ERROR = "Agent dispatch not available";

    private final BridgeAccount account;
    private final ConnectionSession connection;
    private final FileSynchronizer synchronizer;
    private final AgentDispatcher dispatcher;
    private final EventLoop loop;
    private final int textChunkLimit;

    public BridgeSession(BridgeAccount account,
                         ConnectionSession connection,
                         FileSynchronizer synchronizer,
                         AgentDispatcher dispatcher,
                         EventLoop loop,
                         int textChunkLimit) {
        this.account = account;
        this.connection = connection;
        this.synchronizer = synchronizer;
        this.dispatcher = dispatcher;
        this.loop = loop;
        this.textChunkLimit = textChunkLimit;
    }

    public static String sessionKey(String accountId) {
        return "clawcontrol:" + accountId;
    }

    static String withNoteContext(String noteContext, String content) {
        if (noteContext == null || noteContext.isBlank()) {
            return content;
        }
        return "[Note context]\n" + noteContext + "\n\n[User message]\n" + content;
    }

    public BridgeAccount getAccount() {
        return account;
    }

    public ConnectionSession getConnection() {
        return connection;
    }

    public FileSynchronizer getSynchronizer() {
        return synchronizer;
    }

    public void start() {
        connection.setMessageHandler(this::onUserMessage);
        connection.setConnectedHandler(this::onConnected);
        connection.connect();
    }

    public void stop() {
        connection.disconnect();
        if (synchronizer != null) {
            loop.execute(() -> {
                if (synchronizer.isRunning()) {
                    synchronizer.stop();
                }
            });
        }
    }

    private void onConnected() {
        if (synchronizer == null) {
            return;
        }
        if (synchronizer.isRunning()) {
            synchronizer.resync();
            return;
        }
        connection.setFileSyncHandler(synchronizer);
        synchronizer.start();
    }

    void onUserMessage(UserMessageFrame message) {
        String id = message.getId();
        String threadId = message.getThreadId();
        log.info("[{}] user_message id={} threadId={} chars={}", account.getAccountId(), id, threadId,
                message.getContent().length());

        if (dispatcher == null) {
            log.warn("[{}] No agent dispatcher registered, rejecting message {}", account.getAccountId(), id);
            connection.sendError(NO_DISPATCHER_ERROR, id, threadId);
            return;
        }

        InboundTurn turn = InboundTurn.builder()
                .accountId(account.getAccountId())
                .sessionKey(sessionKey(account.getAccountId()))
                .messageId(id)
                .threadId(threadId)
                .sessionId(message.getSessionId())
                .body(withNoteContext(message.getNoteContext(), message.getContent()))
                .rawBody(message.getContent())
                .noteContext(message.getNoteContext())
                .history(message.getHistory())
                .receivedAt(System.currentTimeMillis())
                .build();

        connection.sendTyping(id, threadId);
        CompletableFuture<Void> result;
        try {
            result = dispatcher.dispatch(turn, new TurnReplies(id, threadId));
        } catch (RuntimeException e) {
            replyFailed(id, threadId, e);
            return;
        }
        if (result == null) {
            connection.sendDone(id, threadId);
            return;
        }
        result.whenComplete((ignored, error) -> {
            if (error != null) {
                replyFailed(id, threadId, error);
            } else {
                connection.sendDone(id, threadId);
            }
        });
    }

    private void replyFailed(String id, String threadId, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        log.error("[{}] Dispatch failed for message {}", account.getAccountId(), id, cause);
        String message = cause.getMessage();
        connection.sendError(message == null || message.isBlank() ? cause.getClass().getSimpleName() : message, id, threadId);
    }

    private final class TurnReplies implements ReplySink {
        private final String id;
        private final String threadId;

        private TurnReplies(String id, String threadId) {
            this.id = id;
            this.threadId = threadId;
        }

        @Override
        public void deliver(String text) {
            if (text == null || text.isEmpty()) {
                return;
            }
            for (String chunk : TextChunker.chunk(text, textChunkLimit)) {
                connection.sendText(chunk, id, threadId);
            }
        }

        @Override
        public void typing() {
            connection.sendTyping(id, threadId);
        }
    }
}
