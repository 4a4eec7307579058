package com.alterante.relay.http;

/**
 * Transport lifecycle states.
 */
public enum ConnectionState {
    STARTED,
    CONNECTED,
    /** Clean, requested close. */
    DISCONNECTED,
    /** Unexpected drop; a reconnect is in progress. */
    LOST
}
