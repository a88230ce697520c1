package com.httpcache.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Stored form of an origin response.
 *
 * Header names are kept lower-cased; repeated values of one header are joined
 * with ", " when the record is built from a live response.
 */
@Value
public class HttpResponseRecord {

    private static final byte[] EMPTY_BODY = new byte[0];

    int status;

    Map<String, String> headers;

    byte[] body;

    URI url;

    HttpVersion httpVersion;

    @Builder(toBuilder = true)
    @Jacksonized
    private HttpResponseRecord(int status, Map<String, String> headers, byte[] body, URI url,
                               HttpVersion httpVersion) {
        this.status = status;
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? EMPTY_BODY : body.clone();
        this.url = url;
        this.httpVersion = httpVersion == null ? HttpVersion.HTTP_1_1 : httpVersion;
    }

    /**
     * @return a copy of the body
     */
    public byte[] getBody() {
        return body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    /**
     * Case-insensitive header lookup.
     *
     * @param name header name
     * @return header value or null if absent
     */
    public String header(String name) {
        String value = headers.get(name.toLowerCase(Locale.ROOT));
        if (value != null) {
            return value;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Copy the headers into Spring's multi-value form.
     */
    public HttpHeaders toHttpHeaders() {
        HttpHeaders httpHeaders = new HttpHeaders();
        headers.forEach(httpHeaders::add);
        return httpHeaders;
    }

    /**
     * Flatten Spring headers into the stored ordered map.
     */
    public static Map<String, String> flatten(HttpHeaders httpHeaders) {
        Map<String, String> flat = new LinkedHashMap<>();
        httpHeaders.forEach((name, values) -> {
            if (values != null && !values.isEmpty()) {
                flat.put(name.toLowerCase(Locale.ROOT), String.join(", ", values));
            }
        });
        return flat;
    }
}
