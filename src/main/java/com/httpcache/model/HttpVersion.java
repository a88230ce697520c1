package com.httpcache.model;

/**
 * HTTP protocol version of a stored response.
 */
public enum HttpVersion {
    HTTP_0_9("HTTP/0.9"),
    HTTP_1_0("HTTP/1.0"),
    HTTP_1_1("HTTP/1.1"),
    HTTP_2("HTTP/2.0"),
    HTTP_3("HTTP/3.0");

    private final String protocol;

    HttpVersion(String protocol) {
        this.protocol = protocol;
    }

    /**
     * Wire form, e.g. "HTTP/1.1".
     */
    @Override
    public String toString() {
        return protocol;
    }
}
