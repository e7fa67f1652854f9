package com.stablepeg.service.alert;

import com.stablepeg.config.StablePegProperties;
import com.stablepeg.event.AlertDispatchedEvent;
import com.stablepeg.model.domain.AlertPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

@Slf4j
@Service
public class AlertHistory {

    private final int capacity;
    private final Deque<AlertPayload> recent = new ArrayDeque<>();

    public AlertHistory(StablePegProperties properties) {
        this.capacity = Math.max(1, properties.getAlerts().getHistorySize());
    }

    @EventListener
    public void onAlertDispatched(AlertDispatchedEvent event) {
        synchronized (recent) {
            recent.addFirst(event.getPayload());
            while (recent.size() > capacity) {
                recent.pollLast();
            }
        }
    }

    public List<AlertPayload> getRecent(int limit) {
        List<AlertPayload> result = new ArrayList<>();
        synchronized (recent) {
            Iterator<AlertPayload> it = recent.iterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }

    public int size() {
        synchronized (recent) {
            return recent.size();
        }
    }
}
