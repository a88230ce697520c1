package com.httpcache.model.dto;

import com.httpcache.model.StoredEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Summary view of a cache entry for list endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntrySummary {

    private String key;

    private String url;

    private int status;

    private int bodySize;

    /**
     * When the response was received or last revalidated.
     */
    private Instant storedAt;

    private long ageSeconds;

    /**
     * Remaining freshness; zero or negative when stale.
     */
    private long timeToLiveSeconds;

    private boolean fresh;

    /**
     * Whether an ETag or Last-Modified allows a conditional request.
     */
    private boolean revalidatable;

    public static CacheEntrySummary of(StoredEntry entry, Instant now) {
        return CacheEntrySummary.builder()
                .key(entry.getKey())
                .url(String.valueOf(entry.getResponse().getUrl()))
                .status(entry.getResponse().getStatus())
                .bodySize(entry.getResponse().bodyLength())
                .storedAt(entry.getPolicy().getResponseTime())
                .ageSeconds(entry.getPolicy().ageAt(now))
                .timeToLiveSeconds(entry.getPolicy().timeToLiveAt(now))
                .fresh(entry.getPolicy().isFreshAt(now))
                .revalidatable(entry.getPolicy().hasValidator())
                .build();
    }
}
