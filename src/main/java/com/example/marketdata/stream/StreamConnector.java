package com.example.marketdata.stream;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Opens streaming connections. The JDK WebSocket client is the production implementation.
 */
public interface StreamConnector {

    StreamConnection connect(URI endpoint, Duration timeout, StreamListener listener) throws IOException;
}
