package com.stablepeg.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablepeg.config.StablePegProperties;
import com.stablepeg.model.domain.DeliveryResult;
import com.stablepeg.model.domain.Notification;
import com.stablepeg.model.enums.SubscriptionTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookNotificationChannel implements NotificationChannel {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final StablePegProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "webhook";
    }

    @Override
    public boolean supports(SubscriptionTier tier) {
        String url = properties.getWebhook().getUrls().get(tier);
        return url != null && !url.isBlank();
    }

    @Override
    public DeliveryResult deliver(Notification notification) {
        String url = properties.getWebhook().getUrls().get(notification.audience());
        if (url == null || url.isBlank()) {
            return DeliveryResult.failed("No webhook configured for " + notification.audience());
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(notification.payload());
        } catch (JsonProcessingException e) {
            return DeliveryResult.failed("Failed to encode alert payload: " + e.getMessage());
        }

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                return DeliveryResult.delivered();
            }
            log.error("Webhook {} rejected alert for {}: HTTP {}",
                    url, notification.payload().symbol(), response.code());
            return DeliveryResult.failed("Webhook responded with HTTP " + response.code());
        } catch (IOException e) {
            log.error("Error posting alert to webhook {}: {}", url, e.getMessage());
            return DeliveryResult.failed(e.getMessage());
        }
    }
}
