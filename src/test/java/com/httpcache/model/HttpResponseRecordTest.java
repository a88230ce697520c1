package com.httpcache.model;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpResponseRecordTest {

    private static final URI URL = URI.create("http://example.com/a");

    @Test
    void testBuilderInputsAreCopied() {
        byte[] body = "hello".getBytes(StandardCharsets.UTF_8);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("etag", "\"v1\"");
        HttpResponseRecord record = HttpResponseRecord.builder()
                .status(200)
                .headers(headers)
                .body(body)
                .url(URL)
                .build();

        body[0] = 'j';
        headers.put("etag", "\"v2\"");
        headers.put("x-extra", "1");

        assertEquals("hello", new String(record.getBody(), StandardCharsets.UTF_8));
        assertEquals(Map.of("etag", "\"v1\""), record.getHeaders());
    }

    @Test
    void testAccessorsDoNotExposeState() {
        HttpResponseRecord record = HttpResponseRecord.builder()
                .status(200)
                .headers(Map.of("etag", "\"v1\""))
                .body(new byte[]{1, 2, 3})
                .url(URL)
                .build();

        record.getBody()[0] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, record.getBody());
        assertEquals(3, record.bodyLength());
        assertThrows(UnsupportedOperationException.class, () -> record.getHeaders().put("etag", "\"v2\""));
    }

    @Test
    void testDefaults() {
        HttpResponseRecord record = HttpResponseRecord.builder().status(204).url(URL).build();

        assertEquals(0, record.bodyLength());
        assertTrue(record.getHeaders().isEmpty());
        assertEquals(HttpVersion.HTTP_1_1, record.getHttpVersion());
        assertNull(record.header("etag"));
    }

    @Test
    void testToBuilderKeepsValuesAndEquality() {
        HttpResponseRecord record = HttpResponseRecord.builder()
                .status(200)
                .headers(Map.of("Content-Type", "text/plain"))
                .body("x".getBytes(StandardCharsets.UTF_8))
                .url(URL)
                .build();

        HttpResponseRecord copy = record.toBuilder().build();

        assertEquals(record, copy);
        assertEquals(record.hashCode(), copy.hashCode());
        assertEquals("text/plain", copy.header("content-type"));
        assertNotEquals(record, record.toBuilder().status(404).build());
    }
}
