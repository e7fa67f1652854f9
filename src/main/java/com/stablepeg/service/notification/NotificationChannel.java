package com.stablepeg.service.notification;

import com.stablepeg.model.domain.DeliveryResult;
import com.stablepeg.model.domain.Notification;
import com.stablepeg.model.enums.SubscriptionTier;

public interface NotificationChannel {

    String getName();

    boolean supports(SubscriptionTier tier);

    DeliveryResult deliver(Notification notification);
}
