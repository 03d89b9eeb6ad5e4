package com.sportsautobet.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsautobet.domain.model.DailySelection;
import com.sportsautobet.domain.ports.PicksPublisher;
import com.sportsautobet.infrastructure.http.HttpClientUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends the daily picks to a Telegram chat through the Bot API sendMessage method.
 */
@Component
public class TelegramPicksPublisher implements PicksPublisher {

    private static final Logger logger = LoggerFactory.getLogger(TelegramPicksPublisher.class);

    public static final String PLACEHOLDER_TOKEN = "YOUR_TELEGRAM_BOT_TOKEN_HERE";
    public static final String PLACEHOLDER_CHAT_ID = "YOUR_TELEGRAM_CHAT_ID_HERE";

    private final String baseUrl;
    private final String botToken;
    private final String chatId;

    public TelegramPicksPublisher(
            @Value("${autobet.telegram.base-url:https://api.telegram.org}") String baseUrl,
            @Value("${autobet.telegram.bot-token:" + PLACEHOLDER_TOKEN + "}") String botToken,
            @Value("${autobet.telegram.chat-id:" + PLACEHOLDER_CHAT_ID + "}") String chatId) {
        this.baseUrl = baseUrl;
        this.botToken = botToken;
        this.chatId = chatId;
    }

    public boolean isConfigured() {
        return botToken != null && !botToken.isBlank() && !PLACEHOLDER_TOKEN.equals(botToken)
            && chatId != null && !chatId.isBlank() && !PLACEHOLDER_CHAT_ID.equals(chatId);
    }

    @Override
    public boolean publish(DailySelection selection) throws IOException {
        String text = PicksMessageFormatter.format(selection);
        if (!isConfigured()) {
            logger.warn("Telegram is not configured, message not sent:\n{}", text);
            return false;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);

        JsonNode response = HttpClientUtil.postJson(baseUrl + "/bot" + botToken + "/sendMessage", body, null);
        if (!response.path("ok").asBoolean(false)) {
            throw new IOException("Telegram refused the message: " + response.path("description").asText("no description"));
        }

        logger.info("Sent {} picks for {} to Telegram chat {}", selection.getPicks().size(), selection.getDate(), chatId);
        return true;
    }
}
