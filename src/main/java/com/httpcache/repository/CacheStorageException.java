package com.httpcache.repository;

/**
 * A cache backend failed to read or write.
 */
public class CacheStorageException extends RuntimeException {

    public CacheStorageException(String message) {
        super(message);
    }

    public CacheStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
