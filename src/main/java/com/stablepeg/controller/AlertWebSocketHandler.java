package com.stablepeg.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablepeg.event.AlertDispatchedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class AlertWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.info("WebSocket connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("WebSocket disconnected: {} ({})", session.getId(), status);
    }

    @EventListener
    public void onAlertDispatched(AlertDispatchedEvent event) {
        if (sessions.isEmpty()) return;

        String json;
        try {
            json = objectMapper.writeValueAsString(Map.of(
                    "type", event.getPayload().recovery() ? "recovery" : "alert",
                    "channel", event.getChannel(),
                    "data", event.getPayload()
            ));
        } catch (IOException e) {
            log.error("Failed to encode alert for WebSocket clients", e);
            return;
        }

        for (WebSocketSession session : sessions.values()) {
            if (!session.isOpen()) {
                sessions.remove(session.getId());
                continue;
            }
            try {
                synchronized (session) {
                    session.sendMessage(new TextMessage(json));
                }
            } catch (IOException e) {
                log.warn("Failed to send WebSocket message to {}: {}", session.getId(), e.getMessage());
                closeQuietly(session);
                sessions.remove(session.getId());
            }
        }
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException e) {
            log.debug("Error closing WebSocket {}: {}", session.getId(), e.getMessage());
        }
    }
}
