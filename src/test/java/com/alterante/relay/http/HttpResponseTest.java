package com.alterante.relay.http;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpResponseTest {

    private static byte[] raw(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void parsesStatusHeadersAndBody() throws Exception {
        HttpResponse r = HttpResponse.parse(raw(
                "HTTP/1.1 201 Created\r\nContent-Type: application/json\r\nContent-Length: 2\r\n\r\n{}"));

        assertEquals(201, r.status());
        assertEquals("Created", r.reason());
        assertFalse(r.isOk());
        assertEquals("application/json", r.header("content-type"));
        assertEquals("{}", r.bodyText());
    }

    @Test
    void headerValuesMayContainColons() throws Exception {
        HttpResponse r = HttpResponse.parse(raw("HTTP/1.1 200 OK\r\nLocation: http://h:1/x\r\n\r\n"));
        assertEquals("http://h:1/x", r.header("Location"));
        assertNull(r.header("Missing"));
        assertEquals(0, r.body().length);
    }

    @Test
    void parsesJsonBody() throws Exception {
        HttpResponse r = HttpResponse.parse(raw("HTTP/1.1 200 OK\r\n\r\n{\"taskID\":\"t-7\",\"files\":[\"a\",\"b\"]}"));

        JsonNode json = r.json();
        assertEquals("t-7", json.get("taskID").asText());
        assertEquals(2, json.get("files").size());
    }

    @Test
    void nonJsonBodyIsProtocolError() throws Exception {
        HttpResponse r = HttpResponse.parse(raw("HTTP/1.1 200 OK\r\n\r\n<html>"));
        assertThrows(HttpProtocolException.class, r::json);
    }

    @Test
    void rejectsMissingTerminator() {
        assertThrows(HttpProtocolException.class, () -> HttpResponse.parse(raw("HTTP/1.1 200 OK\r\n")));
    }

    @Test
    void rejectsMalformedStatusLine() {
        assertThrows(HttpProtocolException.class, () -> HttpResponse.parse(raw("HELLO\r\n\r\n")));
        assertThrows(HttpProtocolException.class, () -> HttpResponse.parse(raw("HTTP/1.1 abc OK\r\n\r\n")));
    }
}
