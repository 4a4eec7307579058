package com.alterante.relay;

import com.alterante.relay.queue.CommandQueue;

/**
 * Resolved settings for a {@link MediaRelay}.
 *
 * @param maxRetries       retries per command before it is dropped
 * @param retryDelayMs     delay before a retry
 * @param connectTimeoutMs server connect and read timeout
 * @param keepAlive        TCP keep-alive on the server connection
 * @param server           processing server, or null to run without one
 */
public record RelayConfig(int maxRetries, long retryDelayMs, int connectTimeoutMs, boolean keepAlive, Server server) {

    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;

    /**
     * @param sessionId optional, sent as the {@code Session} header when set
     */
    public record Server(String host, int port, String token, String sessionId) {

        /** Parse {@code host:port}. */
        public static Server parse(String address, String token, String sessionId) {
            int colon = address.lastIndexOf(':');
            if (colon <= 0 || colon == address.length() - 1) {
                throw new IllegalArgumentException("Server address must be host:port, got: " + address);
            }
            int port;
            try {
                port = Integer.parseInt(address.substring(colon + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port in server address: " + address, e);
            }
            return new Server(address.substring(0, colon), port, token, sessionId);
        }
    }

    public RelayConfig {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (retryDelayMs < 0) throw new IllegalArgumentException("retryDelayMs must be >= 0");
    }

    public static RelayConfig defaults() {
        return new RelayConfig(CommandQueue.DEFAULT_RETRIES, CommandQueue.DEFAULT_RETRY_DELAY_MS,
                DEFAULT_CONNECT_TIMEOUT_MS, true, null);
    }

    public RelayConfig withServer(Server server) {
        return new RelayConfig(maxRetries, retryDelayMs, connectTimeoutMs, keepAlive, server);
    }

    public RelayConfig withRetries(int maxRetries, long retryDelayMs) {
        return new RelayConfig(maxRetries, retryDelayMs, connectTimeoutMs, keepAlive, server);
    }
}
