package com.example.marketdata.websocket;

import com.example.marketdata.model.MarketData;
import com.example.marketdata.service.TradeFeedService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * WebSocket handler for the live trade feed.
 * Every trade received by {@link TradeFeedService} is broadcast to all connected clients.
 * Clients may send {"action":"ping"}, {"action":"status"} or
 * {"action":"getLatest","symbol":"AAPL"}.
 */
@Slf4j
@Component
public class TradeWebSocketHandler extends TextWebSocketHandler {

    private final TradeFeedService tradeFeedService;
    private final ObjectMapper objectMapper;

    // Connected WebSocket sessions
    private final Set<WebSocketSession> sessions = ConcurrentHashMap.newKeySet();

    private final Consumer<MarketData> broadcastCallback = this::broadcastTrade;

    public TradeWebSocketHandler(TradeFeedService tradeFeedService, ObjectMapper objectMapper) {
        this.tradeFeedService = tradeFeedService;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        tradeFeedService.registerCallback(broadcastCallback);
        log.info("Trade WebSocket handler initialized");
    }

    @PreDestroy
    public void cleanup() {
        tradeFeedService.removeCallback(broadcastCallback);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        sessions.add(session);
        log.info("WebSocket client connected: {} (total: {})", session.getId(), sessions.size());
        sendMessage(session, Map.of("type", "STATUS", "data", status()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        sessions.remove(session);
        log.info("WebSocket client disconnected: {} (total: {})", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String payload = message.getPayload();
        log.debug("Received message from {}: {}", session.getId(), payload);

        try {
            Map<?, ?> request = objectMapper.readValue(payload, Map.class);
            Object action = request.get("action");

            switch (action != null ? action.toString() : "") {
                case "ping":
                    sendMessage(session, Map.of("type", "pong", "timestamp", System.currentTimeMillis()));
                    break;
                case "status":
                    sendMessage(session, Map.of("type", "STATUS", "data", status()));
                    break;
                case "getLatest":
                    sendLatestTrade(session, request.get("symbol"));
                    break;
                default:
                    sendMessage(session, Map.of("type", "error", "message", "Unknown action: " + action));
            }
        } catch (JsonProcessingException e) {
            log.warn("Malformed WebSocket message from {}: {}", session.getId(), e.getOriginalMessage());
            sendMessage(session, Map.of("type", "error", "message", "Malformed JSON"));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("WebSocket transport error for session {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session);
    }

    private void sendLatestTrade(WebSocketSession session, Object symbol) throws IOException {
        if (symbol == null || symbol.toString().isBlank()) {
            sendMessage(session, Map.of("type", "error", "message", "Missing symbol"));
            return;
        }
        Object data = tradeFeedService.getLatestTrade(symbol.toString())
            .<Object>map(trade -> trade)
            .orElse(Map.of());
        sendMessage(session, Map.of("type", "TRADE", "symbol", symbol.toString().trim().toUpperCase(Locale.ROOT), "data", data));
    }

    private Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>(tradeFeedService.getStatus());
        status.put("connectedClients", getConnectedClientCount());
        return status;
    }

    private void broadcastTrade(MarketData trade) {
        if (sessions.isEmpty()) {
            return;
        }
        String message;
        try {
            message = objectMapper.writeValueAsString(Map.of("type", "TRADE", "data", trade));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize trade for {}", trade.getSymbol(), e);
            return;
        }
        broadcastToAll(message);
    }

    /**
     * Broadcast message to all connected sessions
     */
    private void broadcastToAll(String message) {
        for (WebSocketSession session : sessions) {
            if (session.isOpen()) {
                try {
                    // WebSocketSession does not allow concurrent sends
                    synchronized (session) {
                        session.sendMessage(new TextMessage(message));
                    }
                } catch (IOException e) {
                    log.error("Failed to send message to session {}", session.getId(), e);
                }
            }
        }
    }

    private void sendMessage(WebSocketSession session, Object payload) throws IOException {
        if (session.isOpen()) {
            String json = objectMapper.writeValueAsString(payload);
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        }
    }

    public int getConnectedClientCount() {
        return sessions.size();
    }
}
