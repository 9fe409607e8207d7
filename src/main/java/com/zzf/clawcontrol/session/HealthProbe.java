package com.zzf.clawcontrol.session;

import com.zzf.clawcontrol.config.BridgeAccount;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * One-shot reachability check against {@code GET <url>/health} of the ClawControl app.
 */
@Slf4j
public class HealthProbe {
    private final HttpClient http;
    private final Duration timeout;

    public HealthProbe(HttpClient http, Duration timeout) {
        this.http = http;
        this.timeout = timeout;
    }

    public ProbeResult probe(BridgeAccount account) {
        if (account == null || account.getUrl() == null || account.getUrl().isBlank()) {
            return ProbeResult.failed("not configured", 0L);
        }
        long started = System.currentTimeMillis();
        HttpRequest request;
        try {
            URI uri = URI.create(stripTrailingSlash(account.getUrl()) + "/health");
            request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        } catch (IllegalArgumentException e) {
            return ProbeResult.failed("invalid url: " + e.getMessage(), 0L);
        }
        try {
            HttpResponse<Void> response = http.send(request, HttpResponse.BodyHandlers.discarding());
            long elapsed = System.currentTimeMillis() - started;
            int status = response.statusCode();
            boolean ok = status >= 200 && status < 300;
            return new ProbeResult(ok, status, ok ? null : "HTTP " + status, elapsed);
        } catch (IOException e) {
            log.warn("[{}] health probe failed: {}", account.getAccountId(), e.toString());
            return ProbeResult.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                    System.currentTimeMillis() - started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failed("interrupted", System.currentTimeMillis() - started);
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
