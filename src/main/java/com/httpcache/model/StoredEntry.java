package com.httpcache.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Unit of storage: a response and its freshness policy under one cache key.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StoredEntry {

    String key;

    HttpResponseRecord response;

    FreshnessPolicy policy;
}
