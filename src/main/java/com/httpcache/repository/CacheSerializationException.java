package com.httpcache.repository;

/**
 * A stored record could not be encoded or decoded.
 */
public class CacheSerializationException extends CacheStorageException {

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
