package com.example.marketdata.provider;

import com.example.marketdata.stream.TradeStream;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The network resources of one provider instance: an HTTP client, the executor behind
 * it (also used for trade receive loops), and the streams started through it.
 * Not shared between providers.
 */
@Slf4j
public class ProviderSession implements AutoCloseable {

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final String vendor;
    private final ExecutorService executor;
    private final HttpClient httpClient;
    private final Set<TradeStream> streams = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    private ProviderSession(String vendor, Duration connectTimeout) {
        this.vendor = vendor;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, vendor + "-market-data-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .executor(executor)
            .build();
    }

    public static ProviderSession open(String vendor, Duration connectTimeout) {
        log.debug("Opening {} provider session", vendor);
        return new ProviderSession(vendor, connectTimeout);
    }

    public HttpClient httpClient() {
        ensureOpen();
        return httpClient;
    }

    public ExecutorService executor() {
        ensureOpen();
        return executor;
    }

    public boolean isOpen() {
        return !closed;
    }

    public void register(TradeStream stream) {
        ensureOpen();
        streams.removeIf(s -> s.state().isTerminal());
        streams.add(stream);
    }

    public void unregister(TradeStream stream) {
        streams.remove(stream);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        for (TradeStream stream : new ArrayList<>(streams)) {
            try {
                stream.cancel();
            } catch (RuntimeException e) {
                log.warn("Failed to cancel {} trade stream {}: {}", vendor, stream.symbols(), e.getMessage());
            }
        }
        streams.clear();

        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> pending = executor.shutdownNow();
                log.warn("{} session executor forced down, {} tasks dropped", vendor, pending.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("{} provider session closed", vendor);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException(vendor + " provider session is closed");
        }
    }
}
