package com.alterante.relay.http;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request to send over an {@link HttpConnection}.
 *
 * @param path    request target, including the query string
 * @param method  GET or POST
 * @param headers extra headers, written in iteration order
 * @param body    optional body, may be null
 */
public record HttpRequest(String path, Method method, Map<String, String> headers, byte[] body) {

    public enum Method {
        GET,
        POST
    }

    public HttpRequest {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Request path must start with '/': " + path);
        }
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static HttpRequest get(String path) {
        return new HttpRequest(path, Method.GET, Map.of(), null);
    }

    public static HttpRequest post(String path, String body) {
        return new HttpRequest(path, Method.POST, Map.of(),
                body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    /** Copy of this request with one more header. */
    public HttpRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new HttpRequest(path, method, copy, body);
    }
}
