package com.zzf.clawcontrol.session;

import com.zzf.clawcontrol.config.BridgeAccount;
import com.zzf.clawcontrol.config.BridgeProperties;
import com.zzf.clawcontrol.connection.ConnectionSession;
import com.zzf.clawcontrol.connection.ConnectionSettings;
import com.zzf.clawcontrol.connection.Endpoints;
import com.zzf.clawcontrol.loop.EventLoop;
import com.zzf.clawcontrol.protocol.FrameCodec;
import com.zzf.clawcontrol.sync.DocumentFilter;
import com.zzf.clawcontrol.sync.FileSynchronizer;
import com.zzf.clawcontrol.sync.WatchServiceChangeSource;
import com.zzf.clawcontrol.transport.TransportFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts one {@link BridgeSession} per enabled and configured account and tracks its status.
 */
@Slf4j
@Service
public class BridgeSessionManager {
    private final BridgeProperties properties;
    private final FrameCodec codec;
    private final TransportFactory transportFactory;
    private final EventLoop loop;
    private final AgentDispatcher dispatcher;

    private final Map<String, BridgeSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, RuntimeState> runtime = new ConcurrentHashMap<>();

    private static final class RuntimeState {
        volatile Long lastStartAt;
        volatile Long lastStopAt;
        volatile String lastError;
    }

    @Autowired
    public BridgeSessionManager(BridgeProperties properties,
                                FrameCodec codec,
                                TransportFactory transportFactory,
                                EventLoop loop,
                                ObjectProvider<AgentDispatcher> dispatcher) {
        this(properties, codec, transportFactory, loop, dispatcher.getIfAvailable());
    }

    public BridgeSessionManager(BridgeProperties properties,
                                FrameCodec codec,
                                TransportFactory transportFactory,
                                EventLoop loop,
                                AgentDispatcher dispatcher) {
        this.properties = properties;
        this.codec = codec;
        this.transportFactory = transportFactory;
        this.loop = loop;
        this.dispatcher = dispatcher;
    }

    @PostConstruct
    public void startAll() {
        if (dispatcher == null) {
            log.warn("No AgentDispatcher bean found, user messages will be answered with an error");
        }
        for (String accountId : properties.listAccountIds()) {
            BridgeAccount account = properties.resolveAccount(accountId);
            if (!account.isEnabled()) {
                log.info("[{}] account disabled, skipping", accountId);
                continue;
            }
            if (!account.isConfigured()) {
                log.info("[{}] account has no url/token, skipping", accountId);
                continue;
            }
            startAccount(account);
        }
    }

    @PreDestroy
    public void stopAll() {
        for (String accountId : new ArrayList<>(sessions.keySet())) {
            stopAccount(accountId);
        }
    }

    /**
     * Start (or restart) the session for {@code account}. Returns empty when the account
     * cannot be started; the reason is kept as the account's last error.
     */
    public synchronized Optional<BridgeSession> startAccount(BridgeAccount account) {
        String accountId = account.getAccountId();
        stopAccount(accountId);
        RuntimeState state = runtime.computeIfAbsent(accountId, id -> new RuntimeState());
        if (!account.isConfigured()) {
            state.lastError = "url and token are required";
            log.warn("[{}] cannot start: {}", accountId, state.lastError);
            return Optional.empty();
        }

        ConnectionSession connection;
        try {
            connection = new ConnectionSession(ConnectionSettings.builder()
                    .accountId(accountId)
                    .url(account.getUrl())
                    .token(account.getToken())
                    .reconnectDelayMillis(properties.getReconnectDelayMs())
                    .requestTimeoutMillis(properties.getRequestTimeoutMs())
                    .maxAuthRejections(properties.getMaxAuthRejections())
                    .build(), codec, transportFactory, loop);
        } catch (IllegalArgumentException e) {
            state.lastError = e.getMessage();
            log.error("[{}] invalid ClawControl url: {}", accountId, e.getMessage());
            return Optional.empty();
        }

        FileSynchronizer synchronizer = createSynchronizer(account, connection);
        BridgeSession session = new BridgeSession(account, connection, synchronizer, dispatcher, loop,
                properties.getTextChunkLimit());
        sessions.put(accountId, session);
        state.lastStartAt = System.currentTimeMillis();
        state.lastError = null;
        log.info("[{}] starting ClawControl connection to {} (notes: {})", accountId,
                Endpoints.redact(connection.getEndpoint()), synchronizer == null ? "-" : synchronizer.getRoot());
        session.start();
        return Optional.of(session);
    }

    public synchronized void stopAccount(String accountId) {
        BridgeSession session = sessions.remove(accountId);
        if (session == null) {
            return;
        }
        session.stop();
        runtime.computeIfAbsent(accountId, id -> new RuntimeState()).lastStopAt = System.currentTimeMillis();
        log.info("[{}] stopped", accountId);
    }

    public Optional<BridgeSession> getSession(String accountId) {
        return Optional.ofNullable(sessions.get(accountId));
    }

    public List<AccountStatus> listStatuses() {
        LinkedHashSet<String> ids = new LinkedHashSet<>(properties.listAccountIds());
        ids.addAll(sessions.keySet());
        List<AccountStatus> statuses = new ArrayList<>();
        for (String id : ids) {
            statuses.add(status(id));
        }
        return statuses;
    }

    public AccountStatus status(String accountId) {
        BridgeSession session = sessions.get(accountId);
        BridgeAccount account = session != null ? session.getAccount() : properties.resolveAccount(accountId);
        RuntimeState state = runtime.get(accountId);
        AccountStatus.AccountStatusBuilder builder = AccountStatus.builder()
                .accountId(account.getAccountId())
                .name(account.getName())
                .enabled(account.isEnabled())
                .configured(account.isConfigured())
                .notesPath(account.hasNotesPath() ? account.getNotesPath() : null)
                .running(session != null);
        if (session != null) {
            ConnectionSession connection = session.getConnection();
            builder.connected(connection.isConnected())
                    .retired(connection.isRetired())
                    .state(connection.getState())
                    .endpoint(Endpoints.redact(connection.getEndpoint()))
                    .threadCount(connection.getThreads().size());
        }
        if (state != null) {
            builder.lastStartAt(state.lastStartAt)
                    .lastStopAt(state.lastStopAt)
                    .lastError(state.lastError);
        }
        return builder.build();
    }

    private FileSynchronizer createSynchronizer(BridgeAccount account, ConnectionSession connection) {
        if (!account.hasNotesPath()) {
            return null;
        }
        Path root = Paths.get(account.getNotesPath()).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            log.warn("[{}] notes path {} is not a directory, file sync disabled", account.getAccountId(), root);
            return null;
        }
        BridgeProperties.Sync sync = properties.getSync();
        DocumentFilter filter = new DocumentFilter(sync.getDocumentExtensions() == null
                ? null : new LinkedHashSet<>(sync.getDocumentExtensions()));
        return new FileSynchronizer(root, connection::send, loop, filter, new WatchServiceChangeSource(root, filter),
                sync.getDebounceMs(), sync.getSuppressionWindowMs());
    }
}
