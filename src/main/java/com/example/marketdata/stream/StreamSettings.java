package com.example.marketdata.stream;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class StreamSettings {

    /** Upper bound for connect, auth reply and subscribe reply, each. */
    @Builder.Default
    Duration handshakeTimeout = Duration.ofSeconds(10);

    /** How often the receive loop wakes up to observe cancellation when idle. */
    @Builder.Default
    Duration pollInterval = Duration.ofMillis(250);

    /** How long cancel() waits for the receive loop before forcing teardown. */
    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(5);

    public static StreamSettings defaults() {
        return StreamSettings.builder().build();
    }
}
