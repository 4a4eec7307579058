package com.alterante.relay.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parsed HTTP response: status, headers and body.
 */
public record HttpResponse(int status, String reason, Map<String, String> headers, byte[] body) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parse raw response bytes as returned by {@link HttpConnection#send}.
     *
     * @throws HttpProtocolException if there is no head terminator or no valid status line
     */
    public static HttpResponse parse(byte[] raw) throws HttpProtocolException {
        int end = HttpCodec.headEnd(raw, raw.length);
        if (end < 0) {
            throw new HttpProtocolException("Response has no header terminator");
        }
        String head = new String(raw, 0, end - HttpCodec.HEAD_TERMINATOR.length, StandardCharsets.UTF_8);
        String[] lines = head.split("\r\n");

        // Status line: HTTP/1.1 200 OK
        String[] status = lines[0].split(" ", 3);
        if (status.length < 2 || !status[0].startsWith("HTTP/")) {
            throw new HttpProtocolException("Malformed status line: " + lines[0]);
        }
        int code;
        try {
            code = Integer.parseInt(status[1]);
        } catch (NumberFormatException e) {
            throw new HttpProtocolException("Malformed status code: " + lines[0], e);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; i++) {
            int sep = lines[i].indexOf(": ");
            if (sep > 0) {
                headers.put(lines[i].substring(0, sep), lines[i].substring(sep + 2));
            }
        }

        byte[] body = Arrays.copyOfRange(raw, end, raw.length);
        return new HttpResponse(code, status.length > 2 ? status[2] : "",
                Collections.unmodifiableMap(headers), body);
    }

    public boolean isOk() {
        return status == 200;
    }

    /** Header value by case-insensitive name, or null. */
    public String header(String name) {
        for (Map.Entry<String, String> h : headers.entrySet()) {
            if (h.getKey().equalsIgnoreCase(name)) return h.getValue();
        }
        return null;
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /** Parse the body as JSON. */
    public JsonNode json() throws HttpProtocolException {
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            throw new HttpProtocolException("Response body is not JSON: " + e.getMessage(), e);
        }
    }
}
