package com.zzf.clawcontrol.connection;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Derives the WebSocket endpoint from the app's HTTP base address.
 */
public final class Endpoints {

    private Endpoints() {
    }

    /**
     * {@code http://host:port} becomes {@code ws://host:port/ws?token=...}; {@code https}
     * becomes {@code wss}. One trailing slash on the base address is dropped.
     */
    public static URI resolveWebSocketEndpoint(String baseUrl, String token) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("ClawControl url is empty.");
        }
        String base = baseUrl.trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String lower = base.toLowerCase(Locale.ROOT);
        String scheme = lower.startsWith("https") ? "wss" : "ws";
        String host;
        if (lower.startsWith("https://")) {
            host = base.substring("https://".length());
        } else if (lower.startsWith("http://")) {
            host = base.substring("http://".length());
        } else {
            host = base;
        }
        try {
            return URI.create(scheme + "://" + host + "/ws?token=" + encodeQueryComponent(token == null ? "" : token));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid ClawControl url: " + baseUrl, e);
        }
    }

    /**
     * Endpoint without its query, safe to log.
     */
    public static String redact(URI endpoint) {
        if (endpoint == null) {
            return "";
        }
        String text = endpoint.toString();
        int q = text.indexOf('?');
        return q >= 0 ? text.substring(0, q) : text;
    }

    // percent-encoding as browsers' encodeURIComponent does it
    static String encodeQueryComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }
}
