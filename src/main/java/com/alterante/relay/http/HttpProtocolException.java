package com.alterante.relay.http;

import java.io.IOException;

/**
 * The peer answered with something that is not the response we expect.
 * Retrying the same request will not help.
 */
public class HttpProtocolException extends IOException {

    public HttpProtocolException(String message) {
        super(message);
    }

    public HttpProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
