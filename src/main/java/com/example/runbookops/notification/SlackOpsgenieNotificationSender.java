package com.example.runbookops.notification;

import com.example.runbookops.config.RunbookOpsProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Delivers chat messages through Slack {@code chat.postMessage} and pages through the Opsgenie alert API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlackOpsgenieNotificationSender implements NotificationSender {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final int OPSGENIE_MESSAGE_LIMIT = 130;
    private static final int OPSGENIE_DESCRIPTION_LIMIT = 15000;

    private final RunbookOpsProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public boolean sendChat(String token, String channel, ChatMessage message) {
        if (token == null || token.isBlank() || channel == null || channel.isBlank()) {
            log.warn("Slack token or channel missing, message not sent");
            return false;
        }
        boolean withBlocks = message.getBlocks() != null && !message.getBlocks().isEmpty();
        SlackResult result = postSlack(token, channel, message, withBlocks);
        if (!result.ok && withBlocks && result.error != null && result.error.contains("invalid_blocks")) {
            log.warn("Slack rejected blocks for {}, retrying as plain text", channel);
            result = postSlack(token, channel, message, false);
        }
        if (result.ok) {
            log.info("Slack message sent to {}", channel);
        } else {
            log.error("Slack message to {} failed: {}", channel, result.error);
        }
        return result.ok;
    }

    @Override
    public boolean sendPage(String apiKey, PageAlert alert) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Opsgenie API key missing, page not sent");
            return false;
        }
        String baseUrl = properties.getNotifications().getOpsgenie().getApiUrl();
        try {
            Request request;
            if (alert.isClose()) {
                String alias = URLEncoder.encode(alert.getAlias(), StandardCharsets.UTF_8);
                String json = objectMapper.writeValueAsString(Map.of(
                        "source", properties.getServiceName(),
                        "note", "Monitor condition resolved"));
                request = new Request.Builder()
                        .url(baseUrl + "/" + alias + "/close?identifierType=alias")
                        .header("Authorization", "GenieKey " + apiKey)
                        .post(RequestBody.create(json, JSON))
                        .build();
            } else {
                Map<String, Object> payload = new HashMap<>();
                payload.put("message", truncate(alert.getMessage(), OPSGENIE_MESSAGE_LIMIT));
                payload.put("alias", alert.getAlias());
                payload.put("description", truncate(alert.getDescription(), OPSGENIE_DESCRIPTION_LIMIT));
                payload.put("priority", alert.getPriority());
                payload.put("details", alert.getDetails());
                payload.put("source", properties.getServiceName());
                request = new Request.Builder()
                        .url(baseUrl)
                        .header("Authorization", "GenieKey " + apiKey)
                        .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                        .build();
            }

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.info("Opsgenie {} accepted for alias {}", alert.isClose() ? "close" : "alert", alert.getAlias());
                    return true;
                }
                log.error("Opsgenie request failed: {}", response.code());
                return false;
            }
        } catch (IOException e) {
            log.error("Failed to send Opsgenie alert: {}", e.getMessage());
            return false;
        }
    }

    private SlackResult postSlack(String token, String channel, ChatMessage message, boolean withBlocks) {
        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("channel", channel);
            payload.put("text", message.getText());
            if (withBlocks) {
                payload.put("blocks", message.getBlocks());
            }
            Request request = new Request.Builder()
                    .url(properties.getNotifications().getSlack().getApiUrl())
                    .header("Authorization", "Bearer " + token)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    return new SlackResult(false, "http_" + response.code());
                }
                ResponseBody body = response.body();
                JsonNode json = objectMapper.readTree(body != null ? body.string() : "{}");
                boolean ok = json.path("ok").asBoolean(false);
                return new SlackResult(ok, ok ? null : json.path("error").asText("unknown_error"));
            }
        } catch (IOException e) {
            return new SlackResult(false, e.getMessage());
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static final class SlackResult {
        private final boolean ok;
        private final String error;

        private SlackResult(boolean ok, String error) {
            this.ok = ok;
            this.error = error;
        }
    }
}
