package com.uptimesentinel.service.notify.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.uptimesentinel.core.model.ChannelConfig;
import com.uptimesentinel.core.util.JsonUtils;
import com.uptimesentinel.service.notify.ChannelSender;
import com.uptimesentinel.service.notify.StatusNotification;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

public class TelegramChannelSender implements ChannelSender {
    public static final String TYPE = "telegram";
    static final String DEFAULT_API_BASE_URL = "https://api.telegram.org";
    private static final int MAX_ERROR_LENGTH = 200;
    private static final Pattern NUMERIC_CHAT_ID = Pattern.compile("-?\\d+");
    private static final DateTimeFormatter CHECKED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
    private static final Logger LOGGER = Logger.getLogger(TelegramChannelSender.class.getName());

    private final HttpClient client;
    private final String apiBaseUrl;
    private final String botToken;
    private final String chatId;
    private final Duration timeout;

    public TelegramChannelSender(HttpClient client, String apiBaseUrl, String botToken, String chatId, Duration timeout) {
        this.client = client;
        this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        this.botToken = botToken;
        this.chatId = chatId;
        this.timeout = timeout;
    }

    public static TelegramChannelSender fromConfig(ChannelConfig config, HttpClient client, Duration timeout) {
        return new TelegramChannelSender(
                client,
                config.setting("api_base_url").orElse(DEFAULT_API_BASE_URL),
                config.requiredSetting("bot_token"),
                config.requiredSetting("chat_id"),
                timeout
        );
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean send(StatusNotification notification) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", resolveChatId());
        body.put("text", formatMessage(notification));
        body.put("parse_mode", "Markdown");
        HttpRequest request = HttpRequest.newBuilder(endpoint("sendMessage"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.toJson(body)))
                .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                LOGGER.warning("Telegram returned HTTP " + response.statusCode() + " for monitor " + notification.monitorId());
                return false;
            }
            return apiAccepted(response.body());
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Telegram delivery failed for monitor " + notification.monitorId(), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static String formatMessage(StatusNotification notification) {
        StringBuilder text = new StringBuilder();
        text.append(notification.isUp() ? "✅" : "❌").append(" *Monitor Alert*\n\n");
        text.append("*URL:* ").append(notification.url()).append('\n');
        text.append("*Status:* ").append(notification.status().name()).append('\n');
        if (notification.responseTimeMs() != null) {
            text.append("*Response Time:* ").append(notification.responseTimeMs()).append(" ms\n");
        }
        if (notification.httpStatusCode() != null) {
            text.append("*HTTP Status:* ").append(notification.httpStatusCode()).append('\n');
        }
        String error = notification.errorMessage();
        if (error != null && !error.isBlank()) {
            String shown = error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH) + "...";
            text.append("*Error:* ").append(shown).append('\n');
        }
        text.append("\n*Checked at:* ").append(CHECKED_AT_FORMAT.format(notification.checkedAt()));
        if (notification.previousStatus() != null && notification.previousStatus() != notification.status()) {
            text.append("\n*Previous Status:* ").append(notification.previousStatus().name());
        }
        return text.toString();
    }

    String resolveChatId() {
        if (NUMERIC_CHAT_ID.matcher(chatId).matches()) {
            return chatId;
        }
        String username = chatId.startsWith("@") ? chatId.substring(1) : chatId;
        return lookupChatId(username).orElse(username);
    }

    private Optional<String> lookupChatId(String username) {
        HttpRequest request = HttpRequest.newBuilder(endpoint("getUpdates"))
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                return Optional.empty();
            }
            JsonNode updates = JsonUtils.objectMapper().readTree(response.body()).path("result");
            for (JsonNode update : updates) {
                JsonNode message = update.path("message");
                if (username.equalsIgnoreCase(message.path("from").path("username").asText())) {
                    JsonNode id = message.path("chat").path("id");
                    if (!id.isMissingNode()) {
                        return Optional.of(id.asText());
                    }
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Unable to resolve Telegram chat for @" + username, e);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private static boolean apiAccepted(String body) {
        if (body == null || body.isBlank()) {
            return true;
        }
        try {
            JsonNode ok = JsonUtils.objectMapper().readTree(body).path("ok");
            return ok.isMissingNode() || ok.asBoolean();
        } catch (JsonProcessingException e) {
            // 2xx with a non-JSON body: nothing to contradict the status code
            return true;
        }
    }

    private URI endpoint(String method) {
        return URI.create(apiBaseUrl + "/bot" + botToken + "/" + method);
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
