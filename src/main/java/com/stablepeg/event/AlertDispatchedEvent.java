package com.stablepeg.event;

import com.stablepeg.model.domain.AlertPayload;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class AlertDispatchedEvent extends ApplicationEvent {

    private final AlertPayload payload;
    private final String channel;

    public AlertDispatchedEvent(Object source, AlertPayload payload, String channel) {
        super(source);
        this.payload = payload;
        this.channel = channel;
    }
}
