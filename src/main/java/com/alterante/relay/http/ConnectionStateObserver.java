package com.alterante.relay.http;

/**
 * Receives every distinct state transition of an {@link HttpConnection}.
 * Called on the thread that caused the transition.
 */
@FunctionalInterface
public interface ConnectionStateObserver {

    void onStateChanged(HttpConnection connection, ConnectionState state);
}
