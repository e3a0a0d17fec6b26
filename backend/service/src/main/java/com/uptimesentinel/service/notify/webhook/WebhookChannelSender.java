package com.uptimesentinel.service.notify.webhook;

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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public class WebhookChannelSender implements ChannelSender {
    public static final String TYPE = "webhook";
    static final String URL_SETTING = "webhook_url";
    static final int COLOR_UP = 0x00ff00;
    static final int COLOR_DOWN = 0xff0000;
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final Logger LOGGER = Logger.getLogger(WebhookChannelSender.class.getName());

    private final HttpClient client;
    private final URI webhookUri;
    private final Duration timeout;

    public WebhookChannelSender(HttpClient client, URI webhookUri, Duration timeout) {
        this.client = client;
        this.webhookUri = webhookUri;
        this.timeout = timeout;
    }

    public static WebhookChannelSender fromConfig(ChannelConfig config, HttpClient client, Duration timeout) {
        return new WebhookChannelSender(client, URI.create(config.requiredSetting(URL_SETTING)), timeout);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean send(StatusNotification notification) {
        HttpRequest request = HttpRequest.newBuilder(webhookUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.toJson(payload(notification))))
                .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return true;
            }
            LOGGER.warning("Webhook returned HTTP " + status + " for monitor " + notification.monitorId());
            return false;
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Webhook delivery failed for monitor " + notification.monitorId(), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static WebhookPayload payload(StatusNotification notification) {
        List<Field> fields = new ArrayList<>();
        fields.add(new Field("Monitor URL", notification.url(), false));
        fields.add(new Field("Status", notification.status().name(), true));
        fields.add(new Field("Response Time",
                notification.responseTimeMs() == null ? "n/a" : notification.responseTimeMs() + " ms", true));
        if (notification.httpStatusCode() != null) {
            fields.add(new Field("HTTP Status", String.valueOf(notification.httpStatusCode()), true));
        }
        if (notification.previousStatus() != null) {
            fields.add(new Field("Previous Status", notification.previousStatus().name(), true));
        }
        if (notification.errorMessage() != null && !notification.errorMessage().isBlank()) {
            fields.add(new Field("Error", truncate(notification.errorMessage()), false));
        }
        Embed embed = new Embed(
                notification.isUp() ? "✅ Monitor is UP" : "❌ Monitor is DOWN",
                notification.headline(),
                notification.isUp() ? COLOR_UP : COLOR_DOWN,
                fields,
                notification.checkedAt().toString()
        );
        return new WebhookPayload(List.of(embed));
    }

    private static String truncate(String value) {
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH) + "...";
    }

    record WebhookPayload(List<Embed> embeds) {
    }

    record Embed(String title, String description, int color, List<Field> fields, String timestamp) {
    }

    record Field(String name, String value, boolean inline) {
    }
}
