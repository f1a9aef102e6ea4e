package com.example.marketdata.provider.alpaca;

import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.ProviderCredential;
import com.example.marketdata.stream.HandshakeReply;
import com.example.marketdata.stream.StreamProtocol;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Alpaca stream framing. Every inbound message is a JSON array of envelopes tagged by "T":
 * "success" (connected / authenticated), "error", "subscription", "t" (trade), "q", "b", ...
 */
public class AlpacaStreamProtocol implements StreamProtocol {

    static final String VENDOR = "alpaca";

    private final ObjectMapper objectMapper;

    public AlpacaStreamProtocol(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String authenticationMessage(ProviderCredential credential) throws IOException {
        Map<String, Object> authMessage = Map.of(
            "action", "auth",
            "key", credential.getApiKey() != null ? credential.getApiKey() : "",
            "secret", credential.getApiSecret() != null ? credential.getApiSecret() : ""
        );
        return objectMapper.writeValueAsString(authMessage);
    }

    @Override
    public String subscriptionMessage(List<String> symbols) throws IOException {
        Map<String, Object> message = Map.of(
            "action", "subscribe",
            "trades", symbols
        );
        return objectMapper.writeValueAsString(message);
    }

    @Override
    public List<JsonNode> envelopes(String message) throws IOException {
        JsonNode root = objectMapper.readTree(message);
        List<JsonNode> envelopes = new ArrayList<>();
        if (root == null || root.isMissingNode()) {
            return envelopes;
        }
        if (root.isArray()) {
            root.forEach(envelopes::add);
        } else {
            envelopes.add(root);
        }
        return envelopes;
    }

    @Override
    public HandshakeReply authenticationReply(JsonNode envelope) {
        String msgType = envelope.path("T").asText();
        switch (msgType) {
            case "success":
                // "connected" is the greeting sent on open, not the auth reply
                return "authenticated".equals(envelope.path("msg").asText())
                    ? HandshakeReply.accepted()
                    : HandshakeReply.ignored();
            case "error":
                return HandshakeReply.rejected(describeError(envelope));
            default:
                return HandshakeReply.ignored();
        }
    }

    @Override
    public HandshakeReply subscriptionReply(JsonNode envelope) {
        String msgType = envelope.path("T").asText();
        switch (msgType) {
            case "subscription":
                return HandshakeReply.accepted();
            case "error":
                return HandshakeReply.rejected(describeError(envelope));
            default:
                return HandshakeReply.ignored();
        }
    }

    @Override
    public boolean isTrade(JsonNode envelope) {
        return "t".equals(envelope.path("T").asText());
    }

    @Override
    public boolean isError(JsonNode envelope) {
        return "error".equals(envelope.path("T").asText());
    }

    /**
     * Trade ticks carry no range: open, high and low are zero, close is the trade price.
     */
    @Override
    public MarketData toTrade(JsonNode envelope) {
        BigDecimal price = AlpacaJson.decimal(envelope, "p");
        return MarketData.builder()
            .symbol(AlpacaJson.text(envelope, "S"))
            .timestamp(AlpacaJson.instant(envelope, "t"))
            .open(BigDecimal.ZERO)
            .high(BigDecimal.ZERO)
            .low(BigDecimal.ZERO)
            .close(price)
            .volume(AlpacaJson.wholeNumber(envelope, "s"))
            .provider(VENDOR)
            .build();
    }

    private static String describeError(JsonNode envelope) {
        return envelope.path("code").asInt() + " - " + envelope.path("msg").asText();
    }
}
