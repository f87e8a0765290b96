package com.costguard.anomaly.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.costguard.anomaly.config.CostGuardProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Delivers alerts to an embedded HttpServer standing in for the chat webhook.
 */
class WebhookAnomalyNotifierTest {

    static HttpServer server;
    static int port;
    static final List<String> received = new CopyOnWriteArrayList<>();

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        server.createContext("/hooks/ok", exchange -> {
            received.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.createContext("/hooks/broken", exchange -> {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    @BeforeEach
    void reset() {
        received.clear();
    }

    private WebhookAnomalyNotifier newNotifier(String url) {
        return new WebhookAnomalyNotifier(new CostGuardProperties(null, null, null, null,
                new CostGuardProperties.Notification(null, url, null, null, null), null));
    }

    @Test
    void postsSlackCompatiblePayload() throws IOException {
        WebhookAnomalyNotifier notifier = newNotifier("http://localhost:" + port + "/hooks/ok");

        notifier.send(new AlertMessage("AWS Cost Anomaly - WARNING SPIKE on 2024-03-27", "Daily Cost: $487.00\n"));

        assertThat(received).hasSize(1);
        JsonNode payload = new ObjectMapper().readTree(received.get(0));
        assertThat(payload.get("text").asText())
                .isEqualTo("*AWS Cost Anomaly - WARNING SPIKE on 2024-03-27*\n```\nDaily Cost: $487.00\n```");
    }

    @Test
    void serverErrorIsReportedToCaller() {
        WebhookAnomalyNotifier notifier = newNotifier("http://localhost:" + port + "/hooks/broken");

        assertThatThrownBy(() -> notifier.send(new AlertMessage("subject", "body")))
                .isInstanceOf(RuntimeException.class);
    }

    @Test
    void disabledWithoutUrl() {
        assertThat(newNotifier(null).isEnabled()).isFalse();
        assertThat(newNotifier("http://localhost:" + port + "/hooks/ok").isEnabled()).isTrue();
    }
}
