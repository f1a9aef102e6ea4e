package com.example.marketdata.provider.alpaca;

import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.ProviderCredential;
import com.example.marketdata.stream.HandshakeReply;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlpacaStreamProtocolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AlpacaStreamProtocol protocol = new AlpacaStreamProtocol(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    @DisplayName("auth message carries key and secret")
    void authenticationMessage() throws Exception {
        JsonNode message = json(protocol.authenticationMessage(ProviderCredential.of("PKTEST", "s3cret")));

        assertThat(message.path("action").asText()).isEqualTo("auth");
        assertThat(message.path("key").asText()).isEqualTo("PKTEST");
        assertThat(message.path("secret").asText()).isEqualTo("s3cret");
    }

    @Test
    @DisplayName("subscribe message lists trade symbols")
    void subscriptionMessage() throws Exception {
        JsonNode message = json(protocol.subscriptionMessage(List.of("AAPL", "TSLA")));

        assertThat(message.path("action").asText()).isEqualTo("subscribe");
        assertThat(message.path("trades")).hasSize(2);
        assertThat(message.path("trades").get(1).asText()).isEqualTo("TSLA");
    }

    @Test
    @DisplayName("a single object is treated as a one-element batch")
    void envelopesFromObject() throws Exception {
        assertThat(protocol.envelopes("{\"T\":\"success\",\"msg\":\"connected\"}")).hasSize(1);
        assertThat(protocol.envelopes("[{\"T\":\"t\"},{\"T\":\"q\"}]")).hasSize(2);
    }

    @Test
    @DisplayName("connected greeting is ignored, authenticated accepts, error rejects")
    void authenticationReplies() throws Exception {
        assertThat(protocol.authenticationReply(json("{\"T\":\"success\",\"msg\":\"connected\"}")).getKind())
            .isEqualTo(HandshakeReply.Kind.IGNORED);
        assertThat(protocol.authenticationReply(json("{\"T\":\"success\",\"msg\":\"authenticated\"}")).getKind())
            .isEqualTo(HandshakeReply.Kind.ACCEPTED);

        HandshakeReply rejected = protocol.authenticationReply(json("{\"T\":\"error\",\"code\":402,\"msg\":\"auth failed\"}"));
        assertThat(rejected.getKind()).isEqualTo(HandshakeReply.Kind.REJECTED);
        assertThat(rejected.getDetail()).isEqualTo("402 - auth failed");
    }

    @Test
    @DisplayName("subscription ack is accepted")
    void subscriptionReplies() throws Exception {
        assertThat(protocol.subscriptionReply(json("{\"T\":\"subscription\",\"trades\":[\"AAPL\"]}")).getKind())
            .isEqualTo(HandshakeReply.Kind.ACCEPTED);
        assertThat(protocol.subscriptionReply(json("{\"T\":\"t\",\"S\":\"AAPL\"}")).getKind())
            .isEqualTo(HandshakeReply.Kind.IGNORED);
    }

    @Test
    @DisplayName("trade timestamps accept RFC-3339 and epoch millis")
    void tradeTimestamps() throws Exception {
        MarketData fromText = protocol.toTrade(json(
            "{\"T\":\"t\",\"S\":\"AAPL\",\"p\":185.5,\"s\":100,\"t\":\"2024-01-02T14:30:00.5Z\"}"));
        MarketData fromMillis = protocol.toTrade(json(
            "{\"T\":\"t\",\"S\":\"AAPL\",\"p\":185.5,\"s\":100,\"t\":1704205800500}"));

        assertThat(fromText.getTimestamp()).isEqualTo(Instant.parse("2024-01-02T14:30:00.500Z"));
        assertThat(fromMillis.getTimestamp()).isEqualTo(fromText.getTimestamp());
        assertThat(fromText.getVolume()).isEqualTo(100);
    }

    @Test
    @DisplayName("trade without price is malformed")
    void tradeWithoutPrice() throws Exception {
        JsonNode envelope = json("{\"T\":\"t\",\"S\":\"AAPL\",\"s\":100,\"t\":\"2024-01-02T14:30:00Z\"}");

        assertThat(protocol.isTrade(envelope)).isTrue();
        assertThatThrownBy(() -> protocol.toTrade(envelope)).isInstanceOf(IllegalArgumentException.class);
    }
}
