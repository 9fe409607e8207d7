package com.zzf.clawcontrol.transport;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Records every socket the session opens; tests drive the server side through {@link FakeTransport}.
 */
public class FakeTransportFactory implements TransportFactory {
    private final List<FakeTransport> opened = new ArrayList<>();

    @Override
    public Transport open(URI endpoint, TransportListener listener) {
        FakeTransport transport = new FakeTransport(endpoint, listener);
        opened.add(transport);
        return transport;
    }

    public List<FakeTransport> getOpened() {
        return opened;
    }

    public int openCount() {
        return opened.size();
    }

    public FakeTransport last() {
        return opened.get(opened.size() - 1);
    }

    public static class FakeTransport implements Transport {
        private final URI endpoint;
        private final TransportListener listener;
        private final List<String> sent = new ArrayList<>();
        private Integer closeCode;

        FakeTransport(URI endpoint, TransportListener listener) {
            this.endpoint = endpoint;
            this.listener = listener;
        }

        @Override
        public void sendText(String text) {
            sent.add(text);
        }

        @Override
        public void close(int code, String reason) {
            closeCode = code;
        }

        public void serverOpens() {
            listener.onOpen();
        }

        public void serverSends(String text) {
            listener.onText(text);
        }

        public void serverCloses(int code, String reason) {
            listener.onClose(code, reason);
        }

        public void fails(Throwable error) {
            listener.onError(error);
        }

        public URI getEndpoint() {
            return endpoint;
        }

        public List<String> getSent() {
            return sent;
        }

        public String lastSent() {
            return sent.get(sent.size() - 1);
        }

        public Integer getCloseCode() {
            return closeCode;
        }
    }
}
