package com.example.marketdata.stream;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link StreamConnector} on top of the JDK WebSocket client.
 * Uses the provider session's {@link HttpClient}, so connections share its executor.
 */
@Slf4j
public class JdkWebSocketConnector implements StreamConnector {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);

    private final HttpClient httpClient;

    public JdkWebSocketConnector(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public StreamConnection connect(URI endpoint, Duration timeout, StreamListener listener) throws IOException {
        log.info("Connecting to WebSocket: {}", endpoint);
        CompletableFuture<WebSocket> wsFuture = httpClient.newWebSocketBuilder()
            .connectTimeout(timeout)
            .buildAsync(endpoint, new BufferingListener(listener));
        try {
            WebSocket webSocket = wsFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Connected to WebSocket: {}", endpoint);
            return new JdkStreamConnection(webSocket);
        } catch (InterruptedException e) {
            abandon(wsFuture, endpoint);
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to " + endpoint, e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to connect to " + endpoint, e.getCause());
        } catch (TimeoutException e) {
            abandon(wsFuture, endpoint);
            throw new IOException("Timed out connecting to " + endpoint, e);
        }
    }

    /**
     * Aborts a handshake the caller gave up on, including one that completes later.
     */
    static void abandon(CompletableFuture<WebSocket> wsFuture, URI endpoint) {
        wsFuture.thenAccept(webSocket -> {
            log.warn("Aborting late WebSocket connection to {}", endpoint);
            webSocket.abort();
        });
    }

    private static final class JdkStreamConnection implements StreamConnection {

        private final WebSocket webSocket;

        private JdkStreamConnection(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public void send(String message) throws IOException {
            try {
                webSocket.sendText(message, true).get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while sending", e);
            } catch (ExecutionException e) {
                throw new IOException("Failed to send message", e.getCause());
            } catch (TimeoutException e) {
                throw new IOException("Timed out sending message", e);
            }
        }

        @Override
        public boolean isOpen() {
            return !webSocket.isInputClosed() && !webSocket.isOutputClosed();
        }

        @Override
        public void close() {
            if (!webSocket.isOutputClosed()) {
                try {
                    webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "Client disconnect")
                        .get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.debug("Interrupted while closing WebSocket");
                } catch (ExecutionException | TimeoutException e) {
                    log.debug("WebSocket close handshake did not complete: {}", e.getMessage());
                }
            }
            webSocket.abort();
        }
    }

    /**
     * Joins partial text frames and forwards whole messages.
     */
    private static final class BufferingListener implements WebSocket.Listener {

        private final StreamListener delegate;
        private StringBuilder messageBuffer = new StringBuilder();

        private BufferingListener(StreamListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            log.debug("WebSocket opened");
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            messageBuffer.append(data);
            if (last) {
                String message = messageBuffer.toString();
                messageBuffer = new StringBuilder();
                delegate.onText(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("WebSocket closed: {} - {}", statusCode, reason);
            delegate.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.error("WebSocket error", error);
            delegate.onError(error);
        }
    }
}
