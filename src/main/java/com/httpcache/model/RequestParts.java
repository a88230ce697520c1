package com.httpcache.model;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.net.URI;

/**
 * Identity of an outgoing request: what cache keys and storability rules look at.
 */
@Value
@Builder(toBuilder = true)
public class RequestParts {

    HttpMethod method;

    URI uri;

    @Builder.Default
    HttpVersion version = HttpVersion.HTTP_1_1;

    @Builder.Default
    HttpHeaders headers = HttpHeaders.EMPTY;

    /**
     * Capture the parts of a WebClient request. WebClient negotiates the
     * protocol per connection, so requests are recorded as HTTP/1.1.
     */
    public static RequestParts from(ClientRequest request) {
        return RequestParts.builder()
                .method(request.method())
                .uri(normalize(request.url()))
                .headers(HttpHeaders.readOnlyHttpHeaders(request.headers()))
                .build();
    }

    /**
     * Same request identity under another method; used to find the GET entry
     * an unsafe request invalidates.
     */
    public RequestParts withMethod(HttpMethod other) {
        return toBuilder().method(other).build();
    }

    public boolean isCacheableMethod() {
        return HttpMethod.GET.equals(method) || HttpMethod.HEAD.equals(method);
    }

    static URI normalize(URI uri) {
        if (uri.isAbsolute() && uri.getRawAuthority() != null
                && (uri.getRawPath() == null || uri.getRawPath().isEmpty())) {
            return URI.create(uri.getScheme() + "://" + uri.getRawAuthority() + "/"
                    + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "")
                    + (uri.getRawFragment() != null ? "#" + uri.getRawFragment() : ""));
        }
        return uri;
    }
}
