package com.uptimesentinel.service.notify;

import com.uptimesentinel.core.model.ChannelConfig;
import com.uptimesentinel.service.notify.telegram.TelegramChannelSender;
import com.uptimesentinel.service.notify.webhook.WebhookChannelSender;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

public class ChannelSenderRegistry {
    private final Map<String, Function<ChannelConfig, ChannelSender>> factories = new ConcurrentHashMap<>();

    public static ChannelSenderRegistry withDefaults(HttpClient client, Duration sendTimeout) {
        ChannelSenderRegistry registry = new ChannelSenderRegistry();
        Function<ChannelConfig, ChannelSender> webhook = config -> WebhookChannelSender.fromConfig(config, client, sendTimeout);
        registry.register(WebhookChannelSender.TYPE, webhook);
        registry.register("discord", webhook);
        registry.register(TelegramChannelSender.TYPE, config -> TelegramChannelSender.fromConfig(config, client, sendTimeout));
        return registry;
    }

    public ChannelSenderRegistry register(String type, Function<ChannelConfig, ChannelSender> factory) {
        factories.put(normalize(type), factory);
        return this;
    }

    public boolean supports(String type) {
        return type != null && factories.containsKey(normalize(type));
    }

    public Set<String> supportedTypes() {
        return new TreeSet<>(factories.keySet());
    }

    public ChannelSender create(ChannelConfig config) {
        Function<ChannelConfig, ChannelSender> factory = factories.get(normalize(config.type()));
        if (factory == null) {
            throw new UnsupportedChannelException(config.type());
        }
        return factory.apply(config);
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
