package com.stablepeg.service.cooldown;

import com.stablepeg.exception.CooldownStoreException;
import com.stablepeg.model.domain.DeliveryResult;

/**
 * Result of a delivery made under a cooldown lock. {@code recordFailure} is set when the channel confirmed
 * delivery but the cooldown could not be written; the alert is out, the record is held in memory only.
 */
public record GuardedDelivery(DeliveryResult result, CooldownStoreException recordFailure) {

    public boolean recorded() {
        return result.success() && recordFailure == null;
    }
}
