package com.zzf.clawcontrol.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.clawcontrol.config.BridgeAccount;
import com.zzf.clawcontrol.connection.ConnectionSession;
import com.zzf.clawcontrol.connection.ConnectionSettings;
import com.zzf.clawcontrol.loop.ManualEventLoop;
import com.zzf.clawcontrol.protocol.FrameCodec;
import com.zzf.clawcontrol.sync.DocumentFilter;
import com.zzf.clawcontrol.sync.FileSynchronizer;
import com.zzf.clawcontrol.sync.LocalChangeSource;
import com.zzf.clawcontrol.transport.CloseCodes;
import com.zzf.clawcontrol.transport.FakeTransportFactory;
import com.zzf.clawcontrol.transport.FakeTransportFactory.FakeTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class BridgeSessionTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ManualEventLoop loop;
    private FakeTransportFactory transports;
    private ConnectionSession connection;
    private BridgeAccount account;

    @BeforeEach
    public void setUp() {
        loop = new ManualEventLoop();
        transports = new FakeTransportFactory();
        account = BridgeAccount.builder()
                .accountId("default").name("ClawControl").enabled(true)
                .url("http://localhost:3100").token("t").notesPath("")
                .build();
        connection = new ConnectionSession(ConnectionSettings.builder()
                .accountId("default").url(account.getUrl()).token(account.getToken()).build(),
                new FrameCodec(mapper), transports, loop);
    }

    private FakeTransport startConnected(BridgeSession session) {
        session.start();
        FakeTransport transport = transports.last();
        transport.serverOpens();
        return transport;
    }

    private List<JsonNode> frames(FakeTransport transport) throws Exception {
        List<JsonNode> frames = new ArrayList<>();
        for (String text : transport.getSent()) {
            frames.add(mapper.readTree(text));
        }
        return frames;
    }

    private static String userMessage(String id, String threadId, String content, String noteContext) {
        StringBuilder sb = new StringBuilder("{\"type\":\"user_message\",\"id\":\"" + id + "\"");
        if (threadId != null) {
            sb.append(",\"threadId\":\"").append(threadId).append("\"");
        }
        sb.append(",\"content\":\"").append(content).append("\"");
        if (noteContext != null) {
            sb.append(",\"noteContext\":\"").append(noteContext).append("\"");
        }
        return sb.append("}").toString();
    }

    @Test
    public void testMessageWithoutDispatcherIsAnsweredWithError() throws Exception {
        BridgeSession session = new BridgeSession(account, connection, null, null, loop, 8_000);
        FakeTransport transport = startConnected(session);

        transport.serverSends(userMessage("m1", "t1", "hello", null));

        List<JsonNode> sent = frames(transport);
        assertEquals(2, sent.size());
        JsonNode error = sent.get(1);
        assertEquals("error", error.get("type").asText());
        assertEquals("Agent dispatch not available", error.get("error").asText());
        assertEquals("m1", error.get("id").asText());
        assertEquals("t1", error.get("threadId").asText());
    }

    @Test
    public void testTurnCarriesNoteContextAndSessionKey() {
        AgentDispatcher dispatcher = mock(AgentDispatcher.class);
        when(dispatcher.dispatch(any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        BridgeSession session = new BridgeSession(account, connection, null, dispatcher, loop, 8_000);
        FakeTransport transport = startConnected(session);

        transport.serverSends(userMessage("m1", "t1", "summarize", "# Title"));

        ArgumentCaptor<InboundTurn> turn = ArgumentCaptor.forClass(InboundTurn.class);
        verify(dispatcher).dispatch(turn.capture(), any());
        assertEquals("clawcontrol:default", turn.getValue().getSessionKey());
        assertEquals("[Note context]\n# Title\n\n[User message]\nsummarize", turn.getValue().getBody());
        assertEquals("summarize", turn.getValue().getRawBody());
        assertEquals("t1", turn.getValue().getThreadId());
    }

    @Test
    public void testRepliesAreChunkedBetweenTypingAndDone() throws Exception {
        AgentDispatcher dispatcher = (turn, replies) -> {
            replies.deliver("abcdefghij");
            return CompletableFuture.completedFuture(null);
        };
        BridgeSession session = new BridgeSession(account, connection, null, dispatcher, loop, 4);
        FakeTransport transport = startConnected(session);

        transport.serverSends(userMessage("m1", null, "go", null));

        List<JsonNode> sent = frames(transport);
        assertEquals(6, sent.size());
        assertEquals("agent_typing", sent.get(1).get("type").asText());
        assertEquals("abcd", sent.get(2).get("content").asText());
        assertEquals("efgh", sent.get(3).get("content").asText());
        assertEquals("ij", sent.get(4).get("content").asText());
        assertEquals("agent_done", sent.get(5).get("type").asText());
        assertEquals("m1", sent.get(5).get("id").asText());
        assertFalse(sent.get(5).has("threadId"));
    }

    @Test
    public void testFailedDispatchSendsErrorInsteadOfDone() throws Exception {
        AgentDispatcher dispatcher = (turn, replies) ->
                CompletableFuture.failedFuture(new IllegalStateException("model unavailable"));
        BridgeSession session = new BridgeSession(account, connection, null, dispatcher, loop, 8_000);
        FakeTransport transport = startConnected(session);

        transport.serverSends(userMessage("m1", "t1", "go", null));

        List<JsonNode> sent = frames(transport);
        JsonNode last = sent.get(sent.size() - 1);
        assertEquals("error", last.get("type").asText());
        assertEquals("model unavailable", last.get("error").asText());
        assertTrue(sent.stream().noneMatch(f -> "agent_done".equals(f.get("type").asText())));
    }

    @Test
    public void testThrowingDispatcherSendsError() throws Exception {
        AgentDispatcher dispatcher = (turn, replies) -> {
            throw new IllegalArgumentException("bad turn");
        };
        BridgeSession session = new BridgeSession(account, connection, null, dispatcher, loop, 8_000);
        FakeTransport transport = startConnected(session);

        transport.serverSends(userMessage("m1", null, "go", null));

        JsonNode last = mapper.readTree(transport.lastSent());
        assertEquals("bad turn", last.get("error").asText());
    }

    @Test
    public void testSyncStartsOnFirstConnectAndResyncsOnReconnect(@TempDir Path notes) throws Exception {
        Files.writeString(notes.resolve("a.md"), "A");
        List<String> started = new ArrayList<>();
        LocalChangeSource source = new LocalChangeSource() {
            @Override
            public void start(Consumer<String> onChange) {
                started.add("watch");
            }

            @Override
            public void close() {
                started.add("closed");
            }
        };
        FileSynchronizer synchronizer = new FileSynchronizer(notes, connection::send, loop, DocumentFilter.markdown(),
                source, 300, 1_000);
        BridgeSession session = new BridgeSession(account, connection, synchronizer, null, loop, 8_000);

        FakeTransport first = startConnected(session);
        List<JsonNode> sent = frames(first);
        assertEquals("connected", sent.get(0).get("type").asText());
        assertEquals("file_snapshot", sent.get(1).get("type").asText());
        assertEquals("a.md", sent.get(1).get("files").get(0).get("path").asText());

        first.serverCloses(CloseCodes.ABNORMAL, "restart");
        loop.advance(3_000);
        FakeTransport second = transports.last();
        second.serverOpens();

        assertEquals("file_snapshot", mapper.readTree(second.lastSent()).get("type").asText());
        assertEquals(List.of("watch"), started);

        session.stop();
        assertFalse(synchronizer.isRunning());
        assertEquals(List.of("watch", "closed"), started);
    }
}
