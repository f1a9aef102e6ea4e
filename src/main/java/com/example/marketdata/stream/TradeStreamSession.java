package com.example.marketdata.stream;

import com.example.marketdata.exception.AuthenticationFailedException;
import com.example.marketdata.exception.MarketDataException;
import com.example.marketdata.exception.TransportException;
import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.ProviderCredential;
import com.example.marketdata.model.StreamState;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Owns one WebSocket for one trade subscription and drives it through
 * DISCONNECTED -> CONNECTING -> AUTHENTICATING -> SUBSCRIBING -> STREAMING -> CLOSED,
 * or FAILED on any transport or handshake error.
 *
 * The transport listener only enqueues frames; a single receive task drains the
 * queue, so records reach the sink in transport order. The handshake runs on the
 * caller's thread, the receive loop on the provider's executor. There is no
 * reconnect: callers build retry around this.
 */
@Slf4j
public class TradeStreamSession implements TradeStream {

    private static final String OPERATION = "streamTrades";

    private final String vendor;
    private final URI endpoint;
    private final ProviderCredential credential;
    private final StreamProtocol protocol;
    private final StreamConnector connector;
    private final ExecutorService executor;
    private final StreamSettings settings;

    private final BlockingQueue<InboundFrame> inbound = new LinkedBlockingQueue<>();
    private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.DISCONNECTED);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean finished = new AtomicBoolean();
    private final Map<String, Instant> lastTradeTimes = new HashMap<>();

    private volatile boolean cancelRequested;
    private volatile Throwable failure;
    private volatile Thread receiveThread;
    private volatile List<String> symbols = Collections.emptyList();
    private volatile StreamConnection connection;
    private volatile Future<?> receiveTask;

    public TradeStreamSession(String vendor,
                              URI endpoint,
                              ProviderCredential credential,
                              StreamProtocol protocol,
                              StreamConnector connector,
                              ExecutorService executor,
                              StreamSettings settings) {
        this.vendor = vendor;
        this.endpoint = endpoint;
        this.credential = credential;
        this.protocol = protocol;
        this.connector = connector;
        this.executor = executor;
        this.settings = settings;
    }

    /**
     * Connects, authenticates and subscribes, then starts the receive loop.
     * Handshake failures leave the session FAILED, closed, and are thrown here.
     */
    public TradeStream start(List<String> symbols, Consumer<MarketData> sink) {
        Objects.requireNonNull(sink, "sink");
        if (!state.compareAndSet(StreamState.DISCONNECTED, StreamState.CONNECTING)) {
            throw new IllegalStateException("Stream session already started: " + state.get());
        }
        this.symbols = List.copyOf(symbols);
        String symbolList = String.join(",", this.symbols);
        log.debug("Stream state {} -> {}", StreamState.DISCONNECTED, StreamState.CONNECTING);

        try {
            try {
                connection = connector.connect(endpoint, settings.getHandshakeTimeout(), new QueueingListener());
            } catch (IOException e) {
                throw new TransportException(vendor, OPERATION, symbolList,
                    "Failed to connect to " + endpoint + ": " + e.getMessage(), e);
            }

            transition(StreamState.CONNECTING, StreamState.AUTHENTICATING);
            send(protocol.authenticationMessage(credential), symbolList);
            awaitHandshake(Phase.AUTHENTICATION, symbolList);
            log.info("Authenticated with {} stream", vendor);

            transition(StreamState.AUTHENTICATING, StreamState.SUBSCRIBING);
            send(protocol.subscriptionMessage(this.symbols), symbolList);
            List<JsonNode> pending = awaitHandshake(Phase.SUBSCRIPTION, symbolList);
            log.info("Subscribed to {} trades: {}", vendor, this.symbols);

            transition(StreamState.SUBSCRIBING, StreamState.STREAMING);
            receiveTask = executor.submit(() -> receiveLoop(pending, sink));
            return this;
        } catch (IOException e) {
            TransportException error = new TransportException(vendor, OPERATION, symbolList,
                "Failed to encode handshake message", e);
            terminate(error);
            throw error;
        } catch (RuntimeException e) {
            terminate(e);
            throw e;
        }
    }

    @Override
    public StreamState state() {
        return state.get();
    }

    @Override
    public List<String> symbols() {
        return symbols;
    }

    @Override
    public void cancel() {
        if (state.get().isTerminal()) {
            return;
        }
        cancelRequested = true;
        inbound.offer(InboundFrame.wakeup());

        if (Thread.currentThread() == receiveThread) {
            // called from the sink; the loop exits after this record
            return;
        }
        if (receiveTask == null) {
            terminate(null);
            return;
        }
        try {
            if (!terminated.await(settings.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} receive loop did not stop within {}, forcing teardown", vendor, settings.getShutdownTimeout());
                receiveTask.cancel(true);
                closeConnection();
                if (!terminated.await(settings.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    terminate(null);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeConnection();
        }
        log.info("{} trade stream cancelled: {}", vendor, symbols);
    }

    @Override
    public void await() throws InterruptedException {
        terminated.await();
        rethrowFailure();
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        if (!terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return false;
        }
        rethrowFailure();
        return true;
    }

    @Override
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    private enum Phase { AUTHENTICATION, SUBSCRIPTION }

    /**
     * Waits for the reply to the last handshake message. Returns envelopes that
     * arrived after the reply in the same message.
     */
    private List<JsonNode> awaitHandshake(Phase phase, String symbolList) {
        long deadline = System.nanoTime() + settings.getHandshakeTimeout().toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TransportException(vendor, OPERATION, symbolList,
                    "Timed out waiting for " + phase.name().toLowerCase(Locale.ROOT) + " reply");
            }
            InboundFrame frame;
            try {
                frame = inbound.poll(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(vendor, OPERATION, symbolList,
                    "Interrupted during " + phase.name().toLowerCase(Locale.ROOT), e);
            }
            if (frame == null) {
                continue;
            }
            switch (frame.kind) {
                case CLOSED:
                    throw new TransportException(vendor, OPERATION, symbolList,
                        "Connection closed during " + phase.name().toLowerCase(Locale.ROOT)
                            + ": " + frame.statusCode + " " + frame.reason);
                case ERROR:
                    throw new TransportException(vendor, OPERATION, symbolList,
                        "Transport error during " + phase.name().toLowerCase(Locale.ROOT), frame.error);
                case WAKEUP:
                    continue;
                default:
                    break;
            }

            List<JsonNode> envelopes;
            try {
                envelopes = protocol.envelopes(frame.text);
            } catch (IOException e) {
                throw new TransportException(vendor, OPERATION, symbolList,
                    "Malformed " + phase.name().toLowerCase(Locale.ROOT) + " reply: " + frame.text, e);
            }
            for (int i = 0; i < envelopes.size(); i++) {
                JsonNode envelope = envelopes.get(i);
                HandshakeReply reply = phase == Phase.AUTHENTICATION
                    ? protocol.authenticationReply(envelope)
                    : protocol.subscriptionReply(envelope);
                switch (reply.getKind()) {
                    case ACCEPTED:
                        return envelopes.subList(i + 1, envelopes.size());
                    case REJECTED:
                        if (phase == Phase.AUTHENTICATION) {
                            throw new AuthenticationFailedException(vendor, OPERATION, symbolList,
                                "Authentication rejected: " + reply.getDetail());
                        }
                        throw new TransportException(vendor, OPERATION, symbolList,
                            "Subscription rejected: " + reply.getDetail());
                    default:
                        log.debug("Ignoring {} during {}", envelope, phase.name().toLowerCase(Locale.ROOT));
                }
            }
        }
    }

    private void receiveLoop(List<JsonNode> pending, Consumer<MarketData> sink) {
        receiveThread = Thread.currentThread();
        Throwable error = null;
        try {
            dispatch(pending, sink);
            long pollMillis = settings.getPollInterval().toMillis();
            while (!cancelRequested) {
                InboundFrame frame = inbound.poll(pollMillis, TimeUnit.MILLISECONDS);
                if (frame == null || cancelRequested) {
                    continue;
                }
                if (frame.kind == InboundFrame.Kind.TEXT) {
                    dispatch(parseBatch(frame.text), sink);
                } else if (frame.kind == InboundFrame.Kind.CLOSED) {
                    log.info("{} stream closed by remote: {} - {}", vendor, frame.statusCode, frame.reason);
                    break;
                } else if (frame.kind == InboundFrame.Kind.ERROR) {
                    throw new TransportException(vendor, OPERATION, String.join(",", symbols),
                        "Transport error while streaming", frame.error);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} receive loop interrupted", vendor);
        } catch (MarketDataException e) {
            log.error("{} trade stream failed: {}", vendor, e.getMessage());
            error = e;
        } catch (RuntimeException e) {
            log.error("{} trade stream aborted by sink", vendor, e);
            error = e;
        } finally {
            receiveThread = null;
            terminate(error);
        }
    }

    private List<JsonNode> parseBatch(String message) {
        try {
            return protocol.envelopes(message);
        } catch (IOException e) {
            log.warn("Skipping malformed {} message: {}", vendor, message);
            return Collections.emptyList();
        }
    }

    private void dispatch(List<JsonNode> envelopes, Consumer<MarketData> sink) {
        for (JsonNode envelope : envelopes) {
            if (cancelRequested) {
                return;
            }
            if (!protocol.isTrade(envelope)) {
                if (protocol.isError(envelope)) {
                    log.warn("{} stream error message: {}", vendor, envelope);
                } else {
                    log.debug("{} stream message ignored: {}", vendor, envelope);
                }
                continue;
            }

            MarketData trade;
            try {
                trade = protocol.toTrade(envelope);
            } catch (RuntimeException e) {
                log.warn("Skipping malformed {} trade {}: {}", vendor, envelope, e.getMessage());
                continue;
            }

            Instant previous = lastTradeTimes.put(trade.getSymbol(), trade.getTimestamp());
            if (previous != null && trade.getTimestamp().isBefore(previous)) {
                log.warn("{} trade for {} at {} is earlier than previous {}",
                    vendor, trade.getSymbol(), trade.getTimestamp(), previous);
            }
            sink.accept(trade);
        }
    }

    private void send(String message, String symbolList) {
        try {
            connection.send(message);
        } catch (IOException e) {
            throw new TransportException(vendor, OPERATION, symbolList,
                "Failed to send handshake message: " + e.getMessage(), e);
        }
    }

    private void transition(StreamState from, StreamState to) {
        if (!state.compareAndSet(from, to)) {
            throw new IllegalStateException("Expected stream state " + from + " but was " + state.get());
        }
        log.debug("Stream state {} -> {}", from, to);
    }

    private void terminate(Throwable error) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        closeConnection();
        inbound.clear();
        failure = error;
        StreamState previous = state.getAndSet(error != null ? StreamState.FAILED : StreamState.CLOSED);
        log.debug("Stream state {} -> {}", previous, state.get());
        terminated.countDown();
    }

    private synchronized void closeConnection() {
        if (connection != null) {
            connection.close();
        }
    }

    private void rethrowFailure() {
        Throwable error = failure;
        if (error instanceof RuntimeException) {
            throw (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        if (error != null) {
            throw new TransportException(vendor, OPERATION, String.join(",", symbols), error.getMessage(), error);
        }
    }

    private final class QueueingListener implements StreamListener {

        @Override
        public void onText(String message) {
            inbound.offer(InboundFrame.text(message));
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            inbound.offer(InboundFrame.closed(statusCode, reason));
        }

        @Override
        public void onError(Throwable error) {
            inbound.offer(InboundFrame.error(error));
        }
    }

    private static final class InboundFrame {

        enum Kind { TEXT, CLOSED, ERROR, WAKEUP }

        final Kind kind;
        final String text;
        final int statusCode;
        final String reason;
        final Throwable error;

        private InboundFrame(Kind kind, String text, int statusCode, String reason, Throwable error) {
            this.kind = kind;
            this.text = text;
            this.statusCode = statusCode;
            this.reason = reason;
            this.error = error;
        }

        static InboundFrame text(String text) {
            return new InboundFrame(Kind.TEXT, text, 0, null, null);
        }

        static InboundFrame closed(int statusCode, String reason) {
            return new InboundFrame(Kind.CLOSED, null, statusCode, reason, null);
        }

        static InboundFrame error(Throwable error) {
            return new InboundFrame(Kind.ERROR, null, 0, null, error);
        }

        static InboundFrame wakeup() {
            return new InboundFrame(Kind.WAKEUP, null, 0, null, null);
        }
    }
}
