package com.costguard.anomaly.notification;

import com.costguard.anomaly.config.CostGuardProperties;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Posts alerts to an incoming-webhook URL (Slack compatible {@code {"text": ...}} payload).
 * Uses blocking calls; alerts are sent once per run.
 */
@Component
public class WebhookAnomalyNotifier implements AnomalyNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookAnomalyNotifier.class);

    private final WebClient webClient;
    private final String webhookUrl;
    private final boolean enabled;

    public WebhookAnomalyNotifier(CostGuardProperties properties) {
        this.webhookUrl = properties.notification().webhookUrl();
        this.enabled = properties.notification().hasWebhook();
        this.webClient = WebClient.builder()
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void send(AlertMessage message) {
        var body = Map.of("text", "*" + message.subject() + "*\n```\n" + message.body() + "```");
        webClient.post().uri(webhookUrl)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .doOnError(e -> log.error("Webhook alert delivery failed", e))
                .block();
        log.info("anomaly_alert channel=webhook subject=\"{}\"", message.subject());
    }
}
