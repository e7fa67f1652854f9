package com.stablepeg.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablepeg.config.StablePegProperties;
import com.stablepeg.model.domain.DeliveryResult;
import com.stablepeg.model.domain.Notification;
import com.stablepeg.model.enums.SubscriptionTier;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramNotificationChannel implements NotificationChannel {

    private static final String TELEGRAM_API_URL = "https://api.telegram.org/bot%s/sendMessage";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_MESSAGE_LENGTH = 4096;
    private static final int MAX_RETRY = 3;
    private static final long MAX_RETRY_AFTER_MS = 30_000;

    private final StablePegProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @PostConstruct
    public void init() {
        StablePegProperties.TelegramConfig telegram = properties.getTelegram();
        if (telegram.isEnabled() && hasText(telegram.getBotToken())) {
            log.info("Telegram notifications enabled for tiers {}", telegram.getChatIds().keySet());
        } else {
            log.warn("Telegram notifications disabled or not configured");
        }
    }

    @Override
    public String getName() {
        return "telegram";
    }

    @Override
    public boolean supports(SubscriptionTier tier) {
        StablePegProperties.TelegramConfig telegram = properties.getTelegram();
        return telegram.isEnabled()
                && hasText(telegram.getBotToken())
                && hasText(telegram.getChatIds().get(tier));
    }

    @Override
    public DeliveryResult deliver(Notification notification) {
        if (!supports(notification.audience())) {
            return DeliveryResult.failed("No Telegram chat configured for " + notification.audience());
        }
        String chatId = properties.getTelegram().getChatIds().get(notification.audience());
        String url = String.format(TELEGRAM_API_URL, properties.getTelegram().getBotToken());

        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(buildBody(chatId, notification.text()), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            return DeliveryResult.failed("Failed to encode Telegram message: " + e.getMessage());
        }

        String lastError = "not attempted";
        for (int attempt = 1; attempt <= MAX_RETRY; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    return DeliveryResult.delivered();
                }
                String body = response.body() != null ? response.body().string() : "";
                if (response.code() == 429) {
                    long retryAfterMs = Math.min(retryAfterMs(body, attempt), MAX_RETRY_AFTER_MS);
                    log.warn("Telegram rate limited (429), retry in {}ms (attempt {}/{})",
                            retryAfterMs, attempt, MAX_RETRY);
                    lastError = "rate limited";
                    Thread.sleep(retryAfterMs);
                    continue;
                }
                log.error("Failed to send Telegram message to {}: {} - {}", chatId, response.code(), body);
                return DeliveryResult.failed("Telegram responded with HTTP " + response.code());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return DeliveryResult.failed("interrupted");
            } catch (IOException e) {
                // no retry: the request may have reached Telegram
                log.error("Error sending Telegram message to {}", chatId, e);
                return DeliveryResult.failed(e.getMessage());
            }
        }
        return DeliveryResult.failed("Telegram delivery failed after " + MAX_RETRY + " attempts: " + lastError);
    }

    private String buildBody(String chatId, String text) throws JsonProcessingException {
        if (text.length() > MAX_MESSAGE_LENGTH) {
            text = text.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("disable_web_page_preview", true);
        return objectMapper.writeValueAsString(body);
    }

    private long retryAfterMs(String body, int attempt) {
        long fallback = 1000L * attempt;
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode retryAfter = node.path("parameters").path("retry_after");
            return retryAfter.isNumber() ? retryAfter.asLong() * 1000L : fallback;
        } catch (JsonProcessingException e) {
            log.debug("Unparseable 429 body from Telegram: {}", e.getMessage());
            return fallback;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
