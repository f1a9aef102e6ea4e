package com.example.marketdata.stream;

import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.ProviderCredential;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;

/**
 * Vendor-specific framing for the auth / subscribe / trade-event protocol.
 * {@link TradeStreamSession} drives the state machine; implementations only encode and decode.
 */
public interface StreamProtocol {

    String authenticationMessage(ProviderCredential credential) throws IOException;

    String subscriptionMessage(List<String> symbols) throws IOException;

    /**
     * Splits one inbound text message into its event envelopes.
     */
    List<JsonNode> envelopes(String message) throws IOException;

    HandshakeReply authenticationReply(JsonNode envelope);

    HandshakeReply subscriptionReply(JsonNode envelope);

    boolean isTrade(JsonNode envelope);

    boolean isError(JsonNode envelope);

    /**
     * Translates a trade envelope. Throws {@link IllegalArgumentException} for malformed events.
     */
    MarketData toTrade(JsonNode envelope);
}
