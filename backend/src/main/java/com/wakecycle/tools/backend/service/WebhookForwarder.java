package com.wakecycle.tools.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wakecycle.tools.backend.dto.WebhookPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Posts notification payloads to the configured webhook. Never throws: failures are logged and
 * reported through the return value.
 */
@Component
public class WebhookForwarder {

    private static final Logger log = LoggerFactory.getLogger(WebhookForwarder.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public WebhookForwarder(ObjectMapper objectMapper,
            @Value("${wake-tools.notification.timeout:10s}") Duration timeout) {
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    /**
     * The whole exchange, including the response body, is bounded by the configured timeout.
     *
     * @return {@code true} when the webhook answered with a 2xx status
     */
    public boolean forward(String webhookUrl, WebhookPayload payload) {
        CompletableFuture<HttpResponse<Void>> exchange = null;
        try {
            String body = objectMapper.writeValueAsString(payload);
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(webhookUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            exchange = httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding());
            HttpResponse<Void> response = exchange.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response.statusCode() / 100 != 2) {
                log.warn("Webhook returned status {}", response.statusCode());
                return false;
            }
            return true;
        } catch (TimeoutException e) {
            exchange.cancel(true);
            log.error("Failed to send webhook: no response within {}", timeout);
            return false;
        } catch (ExecutionException e) {
            log.error("Failed to send webhook: {}", e.getCause().getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Failed to send webhook: interrupted");
            return false;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to send webhook: {}", e.getMessage());
            return false;
        }
    }
}
