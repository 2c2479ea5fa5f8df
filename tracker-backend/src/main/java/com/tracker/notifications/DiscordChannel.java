package com.tracker.notifications;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tracker.core.notify.DeliveryException;
import com.tracker.core.notify.NotificationChannel;
import com.tracker.core.notify.Platform;
import com.tracker.core.notify.Recipient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts to a Discord channel through the REST API as a bot user.
 * Only the recipient's own role may be pinged.
 */
public final class DiscordChannel implements NotificationChannel {
    private static final Logger logger = LoggerFactory.getLogger(DiscordChannel.class);

    static final int MAX_CONTENT_LENGTH = 2000;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String botToken;
    private final Duration timeout;

    public DiscordChannel(HttpClient httpClient, ObjectMapper objectMapper,
                          String apiUrl, String botToken, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.botToken = botToken;
        this.timeout = timeout;
        logger.info("Discord notifications enabled");
    }

    @Override
    public Platform platform() {
        return Platform.DISCORD;
    }

    @Override
    public void deliver(Recipient recipient, String text) throws DeliveryException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(buildRequest(recipient, text), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("Discord request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Discord request interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429) {
            throw new DeliveryException("Discord rate limited channel " + recipient.destinationId());
        }
        if (status == 404) {
            throw new DeliveryException("Channel not found for server: " + recipient.displayName());
        }
        if (status < 200 || status >= 300) {
            throw new DeliveryException("Discord returned " + status + ": " + response.body());
        }
        logger.debug("Discord message posted to {}", recipient.displayName());
    }

    HttpRequest buildRequest(Recipient recipient, String text) throws DeliveryException {
        return HttpRequest.newBuilder()
            .uri(URI.create(apiUrl + "/channels/" + recipient.destinationId() + "/messages"))
            .timeout(timeout)
            .header("Authorization", "Bot " + botToken)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody(recipient, text)))
            .build();
    }

    String jsonBody(Recipient recipient, String text) throws DeliveryException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("content", truncate(text));

        ObjectNode allowed = body.putObject("allowed_mentions");
        allowed.putArray("parse");
        recipient.tag().ifPresent(role -> allowed.putArray("roles").add(role));

        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Could not encode Discord payload", e);
        }
    }

    static String truncate(String text) {
        if (text.length() <= MAX_CONTENT_LENGTH) {
            return text;
        }
        int end = MAX_CONTENT_LENGTH - 1;
        // never split a surrogate pair
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + "…";
    }
}
