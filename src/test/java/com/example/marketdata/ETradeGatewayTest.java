package com.example.marketdata;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {"market-data.provider=etrade", "market-data.stream.symbols=AAPL"})
class ETradeGatewayTest {

    @LocalServerPort
    int port;

    @Autowired
    TestRestTemplate rest;

    @Test
    void quoteIsNotImplemented() {
        ResponseEntity<String> response = rest.getForEntity(
            "http://localhost:" + port + "/api/market-data/quote/AAPL", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_IMPLEMENTED);
        assertThat(response.getBody()).contains("\"vendor\":\"etrade\"");
    }

    @Test
    void configuredSymbolsAreIgnoredWithoutTradeStream() {
        ResponseEntity<String> response = rest.getForEntity(
            "http://localhost:" + port + "/api/market-data/stream", String.class);

        assertThat(response.getBody()).contains("\"state\":\"DISCONNECTED\"");
    }
}
