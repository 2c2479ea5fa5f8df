package com.tracker.notifications;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracker.core.notify.DeliveryException;
import com.tracker.core.notify.NotificationChannel;
import com.tracker.core.notify.Platform;
import com.tracker.core.notify.Recipient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Telegram Bot API {@code sendMessage} with HTML parse mode.
 */
public final class TelegramChannel implements NotificationChannel {
    private static final Logger logger = LoggerFactory.getLogger(TelegramChannel.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String botToken;
    private final Duration timeout;

    public TelegramChannel(HttpClient httpClient, ObjectMapper objectMapper,
                           String apiUrl, String botToken, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.botToken = botToken;
        this.timeout = timeout;
        logger.info("Telegram notifications enabled");
    }

    @Override
    public Platform platform() {
        return Platform.TELEGRAM;
    }

    @Override
    public void deliver(Recipient recipient, String text) throws DeliveryException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(buildRequest(recipient, text), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("Telegram request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Telegram request interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new DeliveryException("Telegram returned " + response.statusCode() + ": " + describe(response.body()));
        }
        logger.debug("Telegram notification sent to {}", recipient.displayName());
    }

    HttpRequest buildRequest(Recipient recipient, String text) {
        return HttpRequest.newBuilder()
            .uri(URI.create(String.format("%s/bot%s/sendMessage", apiUrl, botToken)))
            .timeout(timeout)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(formBody(recipient, text)))
            .build();
    }

    static String formBody(Recipient recipient, String text) {
        return String.format("chat_id=%s&text=%s&parse_mode=HTML",
            URLEncoder.encode(recipient.destinationId(), StandardCharsets.UTF_8),
            URLEncoder.encode(text, StandardCharsets.UTF_8));
    }

    /**
     * Pull the {@code description} out of a Bot API error body, falling back to the raw body.
     */
    private String describe(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            String description = root.path("description").asText("");
            return description.isEmpty() ? body : description;
        } catch (IOException e) {
            return body;
        }
    }
}
