package com.zzf.clawcontrol.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "clawcontrol")
public class BridgeProperties {
    public static final String DEFAULT_ACCOUNT_ID = "default";

    private String url = "";
    private String token = "";
    private boolean enabled = true;
    private String notesPath = "";
    private Map<String, Account> accounts = new LinkedHashMap<>();
    private long reconnectDelayMs = 3_000L;
    private long requestTimeoutMs = 10_000L;
    private long connectTimeoutMs = 10_000L;
    private int maxAuthRejections = 5;
    private int textChunkLimit = 8_000;
    private long probeTimeoutMs = 5_000L;
    private Sync sync = new Sync();

    public static class Account {
        private String url = "";
        private String token = "";
        private boolean enabled = true;
        private String notesPath = "";

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNotesPath() {
            return notesPath;
        }

        public void setNotesPath(String notesPath) {
            this.notesPath = notesPath;
        }
    }

    public static class Sync {
        private long debounceMs = 300L;
        private long suppressionWindowMs = 1_000L;
        private List<String> documentExtensions = new ArrayList<>(List.of(".md"));

        public long getDebounceMs() {
            return debounceMs;
        }

        public void setDebounceMs(long debounceMs) {
            this.debounceMs = debounceMs;
        }

        public long getSuppressionWindowMs() {
            return suppressionWindowMs;
        }

        public void setSuppressionWindowMs(long suppressionWindowMs) {
            this.suppressionWindowMs = suppressionWindowMs;
        }

        public List<String> getDocumentExtensions() {
            return documentExtensions;
        }

        public void setDocumentExtensions(List<String> documentExtensions) {
            this.documentExtensions = documentExtensions;
        }
    }

    /**
     * The default account first, then named accounts in configuration order.
     */
    public List<String> listAccountIds() {
        List<String> ids = new ArrayList<>();
        ids.add(DEFAULT_ACCOUNT_ID);
        for (String id : accounts.keySet()) {
            if (!DEFAULT_ACCOUNT_ID.equals(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    /**
     * The default account reads the top-level {@code clawcontrol.*} keys; any other id reads
     * {@code clawcontrol.accounts.<id>.*}. Unknown ids resolve to an unconfigured account.
     */
    public BridgeAccount resolveAccount(String accountId) {
        String id = accountId == null || accountId.isBlank() ? DEFAULT_ACCOUNT_ID : accountId.trim();
        if (DEFAULT_ACCOUNT_ID.equals(id)) {
            return BridgeAccount.builder()
                    .accountId(id)
                    .name("ClawControl")
                    .enabled(enabled)
                    .url(nullToEmpty(url))
                    .token(nullToEmpty(token))
                    .notesPath(nullToEmpty(notesPath))
                    .build();
        }
        Account source = accounts.getOrDefault(id, new Account());
        return BridgeAccount.builder()
                .accountId(id)
                .name("ClawControl (" + id + ")")
                .enabled(source.isEnabled())
                .url(nullToEmpty(source.getUrl()))
                .token(nullToEmpty(source.getToken()))
                .notesPath(nullToEmpty(source.getNotesPath()))
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getNotesPath() {
        return notesPath;
    }

    public void setNotesPath(String notesPath) {
        this.notesPath = notesPath;
    }

    public Map<String, Account> getAccounts() {
        return accounts;
    }

    public void setAccounts(Map<String, Account> accounts) {
        this.accounts = accounts;
    }

    public long getReconnectDelayMs() {
        return reconnectDelayMs;
    }

    public void setReconnectDelayMs(long reconnectDelayMs) {
        this.reconnectDelayMs = reconnectDelayMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getMaxAuthRejections() {
        return maxAuthRejections;
    }

    public void setMaxAuthRejections(int maxAuthRejections) {
        this.maxAuthRejections = maxAuthRejections;
    }

    public int getTextChunkLimit() {
        return textChunkLimit;
    }

    public void setTextChunkLimit(int textChunkLimit) {
        this.textChunkLimit = textChunkLimit;
    }

    public long getProbeTimeoutMs() {
        return probeTimeoutMs;
    }

    public void setProbeTimeoutMs(long probeTimeoutMs) {
        this.probeTimeoutMs = probeTimeoutMs;
    }

    public Sync getSync() {
        return sync;
    }

    public void setSync(Sync sync) {
        this.sync = sync;
    }
}
