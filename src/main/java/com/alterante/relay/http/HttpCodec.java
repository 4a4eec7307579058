package com.alterante.relay.http;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP/1.1 framing helpers shared by every {@link HttpConnection} call.
 *
 * Request head:
 * <pre>
 * METHOD path HTTP/1.1\r\n
 * Host: host:port\r\n
 * Name: value\r\n          (request headers, in order)
 * Content-Length: n\r\n    (only when a body follows)
 * \r\n
 * </pre>
 */
public final class HttpCodec {

    public static final byte[] HEAD_TERMINATOR = {'\r', '\n', '\r', '\n'};

    private HttpCodec() {}

    /**
     * Encode a request head. {@code contentLength} is the number of body bytes that will
     * follow, or -1 for none.
     */
    public static byte[] encodeHead(HttpRequest request, String hostHeader, long contentLength) {
        StringBuilder sb = new StringBuilder(128);
        sb.append(request.method().name()).append(' ').append(request.path()).append(" HTTP/1.1\r\n");
        boolean hasHost = false;
        for (Map.Entry<String, String> h : request.headers().entrySet()) {
            if (h.getKey().equalsIgnoreCase("Host")) hasHost = true;
        }
        if (!hasHost && hostHeader != null) {
            sb.append("Host: ").append(hostHeader).append("\r\n");
        }
        for (Map.Entry<String, String> h : request.headers().entrySet()) {
            if (h.getKey().equalsIgnoreCase("Content-Length")) continue;
            sb.append(h.getKey()).append(": ").append(h.getValue()).append("\r\n");
        }
        if (contentLength >= 0) {
            sb.append("Content-Length: ").append(contentLength).append("\r\n");
        }
        sb.append("\r\n");
        return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    /**
     * Find the end of the response head.
     *
     * @return index of the first body byte, or -1 if the terminator has not arrived yet
     */
    public static int headEnd(byte[] buf, int len) {
        outer:
        for (int i = 0; i <= len - HEAD_TERMINATOR.length; i++) {
            for (int j = 0; j < HEAD_TERMINATOR.length; j++) {
                if (buf[i + j] != HEAD_TERMINATOR[j]) continue outer;
            }
            return i + HEAD_TERMINATOR.length;
        }
        return -1;
    }

    /**
     * Parse the Content-Length header (name matched case-insensitively) from a response head.
     *
     * @return the declared body length, or -1 if the header is absent
     * @throws HttpProtocolException if the header value is not a non-negative number
     */
    public static long contentLength(byte[] head, int headLen) throws HttpProtocolException {
        String text = new String(head, 0, headLen, StandardCharsets.ISO_8859_1);
        for (String line : text.split("\r\n")) {
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            if (!name.equals("content-length")) continue;
            String value = line.substring(colon + 1).trim();
            try {
                long n = Long.parseLong(value);
                if (n < 0) throw new HttpProtocolException("Negative Content-Length: " + value);
                return n;
            } catch (NumberFormatException e) {
                throw new HttpProtocolException("Invalid Content-Length: " + value, e);
            }
        }
        return -1;
    }
}
