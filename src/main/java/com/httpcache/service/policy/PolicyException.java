package com.httpcache.service.policy;

/**
 * A freshness-relevant header could not be interpreted.
 *
 * Never escapes the policy engine: the response is simply not stored.
 */
public class PolicyException extends RuntimeException {

    public PolicyException(String message) {
        super(message);
    }

    public PolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
