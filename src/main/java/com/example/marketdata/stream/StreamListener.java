package com.example.marketdata.stream;

/**
 * Receives transport events from a {@link StreamConnection}. Called on transport threads.
 */
public interface StreamListener {

    /**
     * One complete text message (partial frames already joined).
     */
    void onText(String message);

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}
