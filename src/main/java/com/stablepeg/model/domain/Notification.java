package com.stablepeg.model.domain;

import com.stablepeg.model.enums.SubscriptionTier;

public record Notification(SubscriptionTier audience, String text, AlertPayload payload) {
}
