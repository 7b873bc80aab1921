package com.climaterisklens.alerts;

import com.climaterisklens.metrics.ExternalApiMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.climaterisklens.util.AsciiSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * POSTs alert payloads to subscriber webhooks with a bounded number of
 * attempts and linear backoff. Any non-2xx answer counts as a failed attempt.
 */
public class WebhookNotifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);
    static final String SERVICE = "WEBHOOK";

    private final HttpClient http;
    private final ObjectMapper om;
    private final Duration timeout;
    private final int maxAttempts;
    private final long backoffMillis;

    public WebhookNotifier(ObjectMapper om, int timeoutSeconds, int maxAttempts) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), om, timeoutSeconds, maxAttempts, 1000L);
    }

    WebhookNotifier(HttpClient http, ObjectMapper om, int timeoutSeconds, int maxAttempts, long backoffMillis) {
        this.http = http;
        this.om = om;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = backoffMillis;
    }

    /**
     * Sends the payload (ASCII-sanitized first). Returns true once any attempt
     * gets a 2xx.
     */
    public boolean send(String url, ObjectNode payload) throws InterruptedException {
        String body;
        try {
            body = om.writeValueAsString(AsciiSanitizer.sanitizeTree(payload));
        } catch (Exception e) {
            log.warn("Webhook payload not serializable: {}", e.getMessage());
            return false;
        }
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
        } catch (IllegalArgumentException e) {
            log.warn("Webhook url rejected {}: {}", url, e.getMessage());
            ExternalApiMetrics.record(SERVICE, false);
            return false;
        }

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
                int code = resp.statusCode();
                if (code >= 200 && code < 300) {
                    ExternalApiMetrics.record(SERVICE, true);
                    log.debug("Webhook {} -> {} (attempt {})", url, code, attempt);
                    return true;
                }
                ExternalApiMetrics.record(SERVICE, false);
                log.warn("Webhook {} answered {} (attempt {}/{})", url, code, attempt, maxAttempts);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw ie;
            } catch (Exception e) {
                ExternalApiMetrics.record(SERVICE, false);
                log.warn("Webhook {} failed (attempt {}/{}): {}", url, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts && backoffMillis > 0)
                Thread.sleep(backoffMillis * attempt);
        }
        return false;
    }
}
