package com.sportsautobet.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sportsautobet.domain.model.DailySelection;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TelegramPicksPublisher against a stubbed Bot API.
 */
class TelegramPicksPublisherTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static HttpServer server;
    private static String baseUrl;
    private static final AtomicReference<JsonNode> lastBody = new AtomicReference<>();

    @BeforeAll
    static void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        baseUrl = "http://localhost:" + server.getAddress().getPort();

        server.createContext("/botgood-token/sendMessage", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                lastBody.set(MAPPER.readTree(in));
            }
            reply(exchange, "{\"ok\":true,\"result\":{\"message_id\":1}}");
        });
        server.createContext("/botbad-token/sendMessage", exchange ->
            reply(exchange, "{\"ok\":false,\"description\":\"Bad Request: chat not found\"}"));

        server.start();
    }

    private static void reply(HttpExchange exchange, String json) throws IOException {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @AfterAll
    static void stopServer() {
        server.stop(0);
    }

    @Test
    void testSendsFormattedMessage() throws Exception {
        TelegramPicksPublisher publisher = new TelegramPicksPublisher(baseUrl, "good-token", "-100123");
        DailySelection selection = new DailySelection("2025-05-04", List.of());

        assertTrue(publisher.publish(selection));
        assertEquals("-100123", lastBody.get().get("chat_id").asText());
        assertEquals("No recommendation today (2025-05-04)", lastBody.get().get("text").asText());
    }

    @Test
    void testRefusedMessageFails() {
        TelegramPicksPublisher publisher = new TelegramPicksPublisher(baseUrl, "bad-token", "-100123");

        IOException e = assertThrows(IOException.class,
            () -> publisher.publish(new DailySelection("2025-05-04", List.of())));
        assertTrue(e.getMessage().contains("chat not found"));
    }

    @Test
    void testUnconfiguredPublisherSkipsDelivery() throws Exception {
        TelegramPicksPublisher publisher = new TelegramPicksPublisher(baseUrl,
            TelegramPicksPublisher.PLACEHOLDER_TOKEN, TelegramPicksPublisher.PLACEHOLDER_CHAT_ID);

        assertFalse(publisher.isConfigured());
        assertFalse(publisher.publish(new DailySelection("2025-05-04", List.of())));
    }
}
